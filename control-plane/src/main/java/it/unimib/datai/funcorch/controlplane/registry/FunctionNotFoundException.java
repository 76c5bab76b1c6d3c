package it.unimib.datai.funcorch.controlplane.registry;

public class FunctionNotFoundException extends RuntimeException {
    public FunctionNotFoundException() {
        super("Function not found");
    }

    public FunctionNotFoundException(String functionId) {
        super("Function not found: " + functionId);
    }
}
