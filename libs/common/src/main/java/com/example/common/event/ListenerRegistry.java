/*
 * どこで: Common イベント購読
 * 何を: 状態変化リスナーの登録・解除・通知を一元化する
 * なぜ: ネットワーク監視とキューで同じ通知規約 (例外は記録して握らない) を共有するため
 */
package com.example.common.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe listener list. Listeners are invoked synchronously on the publishing thread, in
 * registration order. A failing listener is logged and does not prevent delivery to the rest.
 */
public class ListenerRegistry<T> {

  private static final Logger logger = LoggerFactory.getLogger(ListenerRegistry.class);

  private final String name;
  private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

  public ListenerRegistry(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public Subscription subscribe(Consumer<? super T> listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public boolean unsubscribe(Consumer<? super T> listener) {
    return listeners.remove(listener);
  }

  public void publish(T event) {
    for (Consumer<? super T> listener : listeners) {
      try {
        listener.accept(event);
      } catch (RuntimeException ex) {
        logger.warn("listener failed registry={} listener={}", name, listener, ex);
      }
    }
  }

  public int size() {
    return listeners.size();
  }

  public void clear() {
    listeners.clear();
  }
}
