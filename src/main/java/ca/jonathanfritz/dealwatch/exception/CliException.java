package ca.jonathanfritz.dealwatch.exception;

public class CliException extends DealWatchException {

    public CliException(String message) {
        super(message);
    }

    public CliException(String message, Throwable t) {
        super(message, t);
    }
}
