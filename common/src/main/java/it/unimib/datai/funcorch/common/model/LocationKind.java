package it.unimib.datai.funcorch.common.model;

/**
 * Variant tag of a {@link FunctionLocation}.
 */
public enum LocationKind {
    /**
     * Function packaged as a blob in a storage container.
     */
    REMOTE,

    /**
     * Function reachable over HTTP at a fixed invoke URL.
     */
    URL,

    /**
     * Function hosted in-process with no storage backing.
     */
    LOCAL
}
