package nl.bytesoflife.heaterrisk.quote;

/**
 * A quote provider could not price a unit.
 */
public class QuoteException extends Exception {

    public QuoteException(String message) {
        super(message);
    }

    public QuoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
