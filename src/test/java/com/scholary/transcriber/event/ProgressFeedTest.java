package com.scholary.transcriber.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcriber.event.ProgressFeed.Subscription;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProgressFeedTest {

  private final ProgressFeed<String> feed = new ProgressFeed<>();

  @Test
  void publish_shouldDeliverToSubscribersInOrder() {
    List<String> received = new ArrayList<>();
    feed.subscribe(e -> received.add("first:" + e));
    feed.subscribe(e -> received.add("second:" + e));

    feed.publish("a");
    feed.publish("b");

    assertThat(received).containsExactly("first:a", "second:a", "first:b", "second:b");
  }

  @Test
  void close_shouldStopDelivery() {
    List<String> received = new ArrayList<>();
    Subscription subscription = feed.subscribe(received::add);

    feed.publish("a");
    subscription.close();
    subscription.close();
    feed.publish("b");

    assertThat(received).containsExactly("a");
    assertThat(feed.subscriberCount()).isZero();
  }

  @Test
  void publish_shouldIsolateFailingListener() {
    List<String> received = new ArrayList<>();
    feed.subscribe(
        e -> {
          throw new IllegalStateException("listener broke");
        });
    feed.subscribe(received::add);

    feed.publish("a");

    assertThat(received).containsExactly("a");
  }

  @Test
  void publish_shouldRejectNullEvent() {
    assertThatThrownBy(() -> feed.publish(null)).isInstanceOf(NullPointerException.class);
  }
}
