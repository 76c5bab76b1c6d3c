package it.unimib.datai.funcorch.controlplane.invoke;

public class HandlerNotFoundException extends RuntimeException {
    public HandlerNotFoundException(String entryPoint) {
        super("No function handler registered for entry point '" + entryPoint + "'");
    }
}
