package it.unimib.datai.funcorch.controlplane.scan;

public class UnknownAccountException extends RuntimeException {
    public UnknownAccountException(String message) {
        super(message);
    }
}
