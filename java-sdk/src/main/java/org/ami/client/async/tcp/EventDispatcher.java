/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.ami.client.async.tcp;

import org.ami.client.async.Subscription;
import org.ami.message.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of the listeners attached to one connection, one list per channel: {@code event},
 * {@code close} and {@code error}.
 *
 * <p>Listeners run in registration order. A listener that throws is logged and skipped; it never
 * prevents the remaining listeners from running and never reaches the connection.
 */
final class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<EventSubscriber> eventListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

    Subscription onEvent(String eventName, Consumer<Event> listener) {
        EventSubscriber subscriber = new EventSubscriber(eventName, listener);
        eventListeners.add(subscriber);
        return () -> eventListeners.remove(subscriber);
    }

    Subscription onClose(Runnable listener) {
        // one wrapper per registration, so cancel() removes exactly this one
        Runnable wrapper = listener::run;
        closeListeners.add(wrapper);
        return () -> closeListeners.remove(wrapper);
    }

    Subscription onError(Consumer<Throwable> listener) {
        Consumer<Throwable> wrapper = listener::accept;
        errorListeners.add(wrapper);
        return () -> errorListeners.remove(wrapper);
    }

    void fireEvent(Event event) {
        for (EventSubscriber subscriber : eventListeners) {
            if (!subscriber.accepts(event)) {
                continue;
            }
            try {
                subscriber.listener().accept(event);
            } catch (Throwable t) {
                log.warn("Event listener failed on {} event", event.getName(), t);
            }
        }
    }

    void fireClose() {
        for (Runnable listener : closeListeners) {
            try {
                listener.run();
            } catch (Throwable t) {
                log.warn("Close listener failed", t);
            }
        }
    }

    void fireError(Throwable cause) {
        for (Consumer<Throwable> listener : errorListeners) {
            try {
                listener.accept(cause);
            } catch (Throwable t) {
                log.warn("Error listener failed", t);
            }
        }
    }

    /**
     * A listener for every event when {@code eventName} is null, otherwise for events of that type.
     */
    private static final class EventSubscriber {
        private final String eventName;
        private final Consumer<Event> listener;

        EventSubscriber(String eventName, Consumer<Event> listener) {
            this.eventName = eventName;
            this.listener = listener;
        }

        Consumer<Event> listener() {
            return listener;
        }

        boolean accepts(Event event) {
            return eventName == null || event.is(eventName);
        }
    }
}
