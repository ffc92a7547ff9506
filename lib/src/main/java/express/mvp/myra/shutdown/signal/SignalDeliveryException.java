package express.mvp.myra.shutdown.signal;

/**
 * Thrown when a termination notification cannot be delivered.
 *
 * <p>{@link TerminationSignal#publish()} raises it when nobody is subscribed. Inside the OS
 * interrupt bridge this is unrecoverable: {@link TerminationHandle} logs it and halts the process.
 */
public class SignalDeliveryException extends RuntimeException {

    /**
     * Constructs a new delivery exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public SignalDeliveryException(String message) {
        super(message);
    }
}
