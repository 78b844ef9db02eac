package ca.jonathanfritz.dealwatch.exception;

public class DealWatchException extends Exception {

    public DealWatchException(String message) {
        super(message);
    }

    public DealWatchException(String message, Throwable t) {
        super(message, t);
    }
}
