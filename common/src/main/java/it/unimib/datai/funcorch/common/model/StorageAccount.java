package it.unimib.datai.funcorch.common.model;

import java.util.Locale;

/**
 * Storage account reference: the account name plus the connection string used to reach it.
 */
public record StorageAccount(String name, String connectionString) {
    public static final String DEVELOPMENT_ACCOUNT_NAME = "devstoreaccount1";
    public static final String DEVELOPMENT_CONNECTION_STRING = "UseDevelopmentStorage=true";

    public StorageAccount {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalArgumentException("Connection string is required");
        }
    }

    public static StorageAccount development() {
        return new StorageAccount(DEVELOPMENT_ACCOUNT_NAME, DEVELOPMENT_CONNECTION_STRING);
    }

    public static StorageAccount fromConnectionString(String connectionString) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalArgumentException("Connection string is required");
        }
        String accountName = null;
        for (String segment : connectionString.split(";")) {
            int eq = segment.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = segment.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = segment.substring(eq + 1).trim();
            if (key.equals("usedevelopmentstorage") && value.equalsIgnoreCase("true")) {
                return development();
            }
            if (key.equals("accountname")) {
                accountName = value;
            }
        }
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("Connection string does not name an account");
        }
        return new StorageAccount(accountName, connectionString);
    }

    /**
     * Builds the account from a name and key. The local development account needs no key.
     */
    public static StorageAccount fromNameAndKey(String accountName, String accountKey) {
        if (DEVELOPMENT_ACCOUNT_NAME.equals(accountName)) {
            return development();
        }
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        if (accountKey == null || accountKey.isBlank()) {
            throw new IllegalArgumentException("Account key is required for account " + accountName);
        }
        return new StorageAccount(accountName,
                "DefaultEndpointsProtocol=https;AccountName=" + accountName
                        + ";AccountKey=" + accountKey
                        + ";EndpointSuffix=core.windows.net");
    }

    public static String accountNameOf(String connectionString) {
        return fromConnectionString(connectionString).name();
    }

    @Override
    public String toString() {
        // Keys stay out of logs.
        return "StorageAccount[" + name + "]";
    }
}
