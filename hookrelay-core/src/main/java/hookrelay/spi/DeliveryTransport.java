package hookrelay.spi;

import hookrelay.model.Delivery;
import hookrelay.model.Subscription;

/**
 * Sends one attempt of a delivery to its subscriber.
 *
 * <p>Implementations never throw for network or protocol failures; they report them
 * through {@link TransportResponse}, so every call results in exactly one recorded attempt.
 *
 * @see hookrelay.http.HttpDeliveryTransport
 */
@FunctionalInterface
public interface DeliveryTransport {

    /**
     * @param delivery      the delivery, as persisted before this attempt
     * @param subscription  the target subscription
     * @param attemptNumber the 1-based number of this attempt
     * @return the outcome of the call
     */
    TransportResponse send(Delivery delivery, Subscription subscription, int attemptNumber);
}
