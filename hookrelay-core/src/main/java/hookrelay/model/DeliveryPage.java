package hookrelay.model;

import java.util.List;

/**
 * One page of deliveries, newest first, plus the total number of rows matching the filter.
 */
public record DeliveryPage(List<Delivery> deliveries, long total) {
  public DeliveryPage {
    deliveries = List.copyOf(deliveries);
  }
}
