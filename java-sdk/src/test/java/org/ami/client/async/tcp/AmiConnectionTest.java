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

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;
import org.ami.client.async.Subscription;
import org.ami.exception.AmiAuthenticationException;
import org.ami.exception.AmiConnectionClosedException;
import org.ami.exception.AmiConnectionException;
import org.ami.exception.AmiConnectionEndingException;
import org.ami.exception.AmiInvalidArgumentException;
import org.ami.exception.AmiResponseException;
import org.ami.message.Action;
import org.ami.message.Event;
import org.ami.message.Fields;
import org.ami.message.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.ami.client.async.tcp.AmiFrames.block;
import static org.ami.client.async.tcp.AmiFrames.bytes;
import static org.ami.client.async.tcp.AmiFrames.readAction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmiConnectionTest {

    private EmbeddedChannel channel;
    private AmiConnection connection;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel();
        connection = new AmiConnection(channel);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void receive(String text) {
        channel.writeInbound(bytes(text));
    }

    private String sendAndReadId(String actionName, List<CompletableFuture<Response>> futures) {
        futures.add(connection.queue(Action.of(actionName)));
        return readAction(channel).getFirst("ActionID").orElseThrow();
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        assertThat(future).isCompletedExceptionally();
        try {
            future.join();
        } catch (CompletionException e) {
            return e.getCause();
        }
        throw new AssertionError("future did not fail");
    }

    @Nested
    class Correlation {

        @Test
        void shouldWriteActionWithGeneratedActionId() {
            // when
            CompletableFuture<Response> future = connection.queue(Action.of("Ping"));

            // then
            Fields written = readAction(channel);
            assertThat(written.getFirst("Action")).contains("Ping");
            assertThat(written.getFirst("ActionID").orElseThrow()).isNotBlank();
            assertThat(future).isNotDone();
            assertThat(connection.pendingCount()).isEqualTo(1);
        }

        @Test
        void shouldKeepCallerSuppliedActionId() {
            // when
            connection.queue(Action.builder("Ping").actionId("my-id").build());

            // then
            assertThat(readAction(channel).getFirst("ActionID")).contains("my-id");
        }

        @Test
        void shouldAssignDistinctIdsToOutstandingActions() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            Set<String> ids = new HashSet<>();

            // when
            for (int i = 0; i < 500; i++) {
                ids.add(sendAndReadId("Ping", futures));
            }

            // then
            assertThat(ids).hasSize(500);
            assertThat(connection.pendingCount()).isEqualTo(500);
        }

        @Test
        void shouldResolveEachResponseToItsOwnActionRegardlessOfOrder() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String first = sendAndReadId("Ping", futures);
            String second = sendAndReadId("CoreStatus", futures);
            String third = sendAndReadId("CoreSettings", futures);

            // when
            receive(block("Response: Success", "ActionID: " + third, "AsteriskVersion: 20.5.0"));
            receive(block("Response: Success", "ActionID: " + first, "Ping: Pong"));

            // then
            assertThat(futures.get(0).join().get("Ping")).contains("Pong");
            assertThat(futures.get(1)).isNotDone();
            assertThat(futures.get(2).join().get("AsteriskVersion")).contains("20.5.0");

            // when
            receive(block("Response: Success", "ActionID: " + second, "CoreReloadTime: 12:00:00"));

            // then
            assertThat(futures.get(1).join().getActionId()).contains(second);
            assertThat(connection.pendingCount()).isZero();
        }

        @Test
        void shouldDropResponseWithUnknownActionId() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            sendAndReadId("Ping", futures);
            AtomicInteger errors = new AtomicInteger();
            connection.onError(cause -> errors.incrementAndGet());

            // when
            receive(block("Response: Success", "ActionID: nobody-1"));

            // then
            assertThat(futures.get(0)).isNotDone();
            assertThat(errors).hasValue(0);
            assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
        }

        @Test
        void shouldDropResponseWithoutActionId() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            sendAndReadId("Ping", futures);

            // when
            receive(block("Response: Success", "Message: who asked?"));

            // then
            assertThat(futures.get(0)).isNotDone();
            assertThat(connection.pendingCount()).isEqualTo(1);
        }

        @Test
        void shouldIgnoreSecondResponseForSameActionId() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Ping", futures);

            // when
            receive(block("Response: Success", "ActionID: " + id, "Ping: Pong"));
            receive(block("Response: Error", "ActionID: " + id, "Message: late duplicate"));

            // then
            assertThat(futures.get(0).join().isSuccess()).isTrue();
            assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
        }

        @Test
        void shouldRejectActionIdThatIsAlreadyPending() {
            // given
            CompletableFuture<Response> original = connection.queue(Action.builder("Ping").actionId("dup").build());
            readAction(channel);

            // when
            CompletableFuture<Response> duplicate = connection.queue(Action.builder("Ping").actionId("dup").build());

            // then
            assertThat(failureOf(duplicate)).isInstanceOf(AmiInvalidArgumentException.class);
            assertThat(readAction(channel)).isNull();
            assertThat(original).isNotDone();
            assertThat(connection.pendingCount()).isEqualTo(1);
        }

        @Test
        void shouldReuseActionIdOnceAnswered() {
            // given
            connection.queue(Action.builder("Ping").actionId("again").build());
            receive(block("Response: Success", "ActionID: again"));

            // when
            CompletableFuture<Response> second = connection.queue(Action.builder("Ping").actionId("again").build());

            // then
            assertThat(second).isNotDone();
            assertThat(connection.pendingCount()).isEqualTo(1);
        }
    }

    @Nested
    class ProtocolErrors {

        @Test
        void shouldFailActionWithResponseException() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Hangup", futures);

            // when
            receive(block("Response: Error", "ActionID: " + id, "Message: No such channel"));

            // then
            Throwable failure = failureOf(futures.get(0));
            assertThat(failure).isExactlyInstanceOf(AmiResponseException.class);
            AmiResponseException error = (AmiResponseException) failure;
            assertThat(error.getReason()).isEqualTo("No such channel");
            assertThat(error.getActionId()).contains(id);
            assertThat(error.getResponse().getStatus()).isEqualTo("Error");
            assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
        }

        @Test
        void shouldFailRejectedLoginWithAuthenticationException() {
            // given
            CompletableFuture<Response> login = connection.queue(Action.builder("Login")
                    .field("Username", "admin")
                    .field("Secret", "wrong")
                    .build());
            String id = readAction(channel).getFirst("ActionID").orElseThrow();

            // when
            receive(block("Response: Error", "ActionID: " + id, "Message: Authentication failed"));

            // then
            assertThat(failureOf(login))
                    .isInstanceOf(AmiAuthenticationException.class)
                    .hasMessageContaining("Authentication failed");
        }

        @Test
        void shouldTreatNonErrorStatusAsSuccess() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Logoff", futures);

            // when
            receive(block("Response: Goodbye", "ActionID: " + id, "Message: Thanks for all the fish."));

            // then
            assertThat(futures.get(0).join().getStatus()).isEqualTo("Goodbye");
        }

        @Test
        void shouldCompleteFollowsResponseWithoutEndMarker() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Command", futures);
            List<Event> received = new ArrayList<>();
            connection.onEvent(received::add);

            // when
            receive(block("Response: Follows", "ActionID: " + id, "Message: Command output follows")
                    + block("Event: FullyBooted"));

            // then
            assertThat(futures.get(0).join().getMessage()).contains("Command output follows");
            assertThat(received).extracting(Event::getName).containsExactly("FullyBooted");
        }

        @Test
        void shouldCompleteCommandWithCollectedOutput() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Command", futures);

            // when
            receive("Response: Follows\r\nPrivilege: Command\r\nActionID: " + id
                    + "\r\nSystem uptime: 1 hour\r\n--END COMMAND--\r\n\r\n");

            // then
            assertThat(futures.get(0).join().getOutput()).contains("System uptime: 1 hour");
        }
    }

    @Nested
    class Events {

        @Test
        void shouldDeliverEventsToListenersInRegistrationOrder() {
            // given
            List<String> received = new ArrayList<>();
            connection.onEvent(event -> received.add("first:" + event.getName()));
            connection.onEvent(event -> received.add("second:" + event.getName()));

            // when
            receive(block("Event: Newchannel", "Channel: PJSIP/100-1") + block("Event: Hangup", "Cause: 16"));

            // then
            assertThat(received)
                    .containsExactly("first:Newchannel", "second:Newchannel", "first:Hangup", "second:Hangup");
        }

        @Test
        void shouldKeepDeliveringWhenListenerThrows() {
            // given
            List<Event> received = new ArrayList<>();
            connection.onEvent(event -> {
                throw new IllegalStateException("listener bug");
            });
            connection.onEvent(received::add);

            // when
            receive(block("Event: PeerStatus", "PeerStatus: Reachable") + block("Event: PeerStatus"));

            // then
            assertThat(received).hasSize(2);
            assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
        }

        @Test
        void shouldKeepConnectionOpenWhenListenerThrowsError() {
            // given
            List<Event> received = new ArrayList<>();
            List<Throwable> errors = new ArrayList<>();
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Ping", futures);
            connection.onEvent(event -> {
                throw new AssertionError("listener bug");
            });
            connection.onEvent(received::add);
            connection.onError(errors::add);

            // when
            receive(block("Event: PeerStatus") + block("Response: Success", "ActionID: " + id));

            // then
            assertThat(received).hasSize(1);
            assertThat(errors).isEmpty();
            assertThat(futures.get(0)).isCompleted();
            assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
        }

        @Test
        void shouldFilterNamedListenerCaseInsensitively() {
            // given
            List<Event> hangups = new ArrayList<>();
            connection.onEvent("hangup", hangups::add);

            // when
            receive(block("Event: Newchannel") + block("Event: Hangup", "Channel: PJSIP/100-1"));

            // then
            assertThat(hangups).extracting(event -> event.get("Channel").orElseThrow())
                    .containsExactly("PJSIP/100-1");
        }

        @Test
        void shouldNotMatchEventsAgainstPendingActions() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Status", futures);
            List<Event> received = new ArrayList<>();
            connection.onEvent(received::add);

            // when
            receive(block("Event: Status", "ActionID: " + id, "Channel: PJSIP/100-1"));

            // then
            assertThat(futures.get(0)).isNotDone();
            assertThat(received).hasSize(1);
        }

        @Test
        void shouldStopDeliveringAfterCancel() {
            // given
            List<Event> received = new ArrayList<>();
            Subscription subscription = connection.onEvent(received::add);
            receive(block("Event: A"));

            // when
            subscription.cancel();
            receive(block("Event: B"));

            // then
            assertThat(received).extracting(Event::getName).containsExactly("A");
        }

        @Test
        void shouldCancelOnlyOneOfTwoIdenticalRegistrations() {
            // given
            AtomicInteger calls = new AtomicInteger();
            Consumer<Event> listener = event -> calls.incrementAndGet();
            Subscription first = connection.onEvent(listener);
            connection.onEvent(listener);

            // when
            first.cancel();
            receive(block("Event: A"));

            // then
            assertThat(calls).hasValue(1);
        }

        @Test
        void shouldDropBlocksThatAreNeitherResponseNorEvent() {
            // given
            List<Event> received = new ArrayList<>();
            connection.onEvent(received::add);

            // when
            receive(block("Channel: PJSIP/100-1", "State: Up") + block("Event: After"));

            // then
            assertThat(received).extracting(Event::getName).containsExactly("After");
        }

        @Test
        void shouldRecordBanner() {
            // when
            receive("Asterisk Call Manager/6.0.0\r\n");

            // then
            assertThat(connection.getBanner()).map(ManagerBanner::text).contains("Asterisk Call Manager/6.0.0");
            assertThat(connection.getProtocolVersion()).contains("6.0.0");
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldStartOpen() {
            assertThat(connection.getState()).isEqualTo(ConnectionState.OPEN);
            assertThat(connection.isOpen()).isTrue();
            assertThat(connection.closeFuture()).isNotDone();
        }

        @Test
        void shouldCloseOnlyAfterLastPendingActionOnEnd() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String first = sendAndReadId("Ping", futures);
            String second = sendAndReadId("Ping", futures);

            // when
            CompletableFuture<Void> closed = connection.end();

            // then
            assertThat(connection.getState()).isEqualTo(ConnectionState.ENDING);
            assertThat(closed).isNotDone();
            assertThat(channel.isOpen()).isTrue();

            // when
            receive(block("Response: Success", "ActionID: " + second));

            // then
            assertThat(futures.get(1)).isCompleted();
            assertThat(closed).isNotDone();

            // when
            receive(block("Response: Success", "ActionID: " + first));

            // then
            assertThat(futures.get(0)).isCompleted();
            assertThat(closed).isCompleted();
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
            assertThat(channel.isOpen()).isFalse();
        }

        @Test
        void shouldDeliverEventsWhileEnding() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            sendAndReadId("Ping", futures);
            List<Event> received = new ArrayList<>();
            connection.onEvent(received::add);
            connection.end();

            // when
            receive(block("Event: Newchannel"));

            // then
            assertThat(received).hasSize(1);
        }

        @Test
        void shouldCloseImmediatelyWhenEndingWithNothingPending() {
            // when
            CompletableFuture<Void> closed = connection.end();

            // then
            assertThat(closed).isCompleted();
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
        }

        @Test
        void shouldRejectActionsAfterEnd() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            sendAndReadId("Ping", futures);
            connection.end();

            // when
            CompletableFuture<Response> late = connection.queue(Action.of("Ping"));

            // then
            assertThat(failureOf(late)).isInstanceOf(AmiConnectionEndingException.class);
            assertThat(readAction(channel)).isNull();
        }

        @Test
        void shouldFailPendingActionsInSendOrderOnClose() {
            // given
            List<String> failedOrder = new ArrayList<>();
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            for (String name : List.of("Ping", "CoreStatus", "CoreSettings")) {
                CompletableFuture<Response> future = connection.queue(Action.of(name));
                future.whenComplete((response, error) -> failedOrder.add(name));
                futures.add(future);
            }

            // when
            CompletableFuture<Void> closed = connection.close();

            // then
            assertThat(failedOrder).containsExactly("Ping", "CoreStatus", "CoreSettings");
            for (CompletableFuture<Response> future : futures) {
                assertThat(failureOf(future)).isExactlyInstanceOf(AmiConnectionClosedException.class);
            }
            assertThat(closed).isCompleted();
            assertThat(connection.pendingCount()).isZero();
            assertThat(channel.isOpen()).isFalse();
        }

        @Test
        void shouldNotDispatchAnythingReadAfterClose() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            List<String> ids = List.of(
                    sendAndReadId("Ping", futures), sendAndReadId("CoreStatus", futures), sendAndReadId("Status", futures));
            List<Event> events = new ArrayList<>();
            List<Throwable> errors = new ArrayList<>();
            connection.onEvent(events::add);
            connection.onError(errors::add);
            connection.close();

            // when
            StringBuilder late = new StringBuilder();
            for (String id : ids) {
                late.append(block("Response: Success", "ActionID: " + id));
            }
            late.append(block("Event: Hangup", "Channel: PJSIP/100-1"));
            channel.pipeline().fireChannelRead(bytes(late.toString()));

            // then
            assertThat(events).isEmpty();
            assertThat(errors).isEmpty();
            for (CompletableFuture<Response> future : futures) {
                assertThat(failureOf(future)).isExactlyInstanceOf(AmiConnectionClosedException.class);
            }
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
        }

        @Test
        void shouldRejectActionsAfterClose() {
            // given
            connection.close();

            // when
            CompletableFuture<Response> late = connection.queue(Action.of("Ping"));

            // then
            assertThat(failureOf(late)).isExactlyInstanceOf(AmiConnectionClosedException.class);
        }

        @Test
        void shouldRunCloseListenersOnce() {
            // given
            AtomicInteger closes = new AtomicInteger();
            connection.onClose(closes::incrementAndGet);

            // when
            connection.close();
            connection.close();
            connection.end();

            // then
            assertThat(closes).hasValue(1);
        }

        @Test
        void shouldStopDispatchingOnceListenerClosesConnection() {
            // given
            List<String> received = new ArrayList<>();
            connection.onEvent(event -> {
                received.add(event.getName());
                connection.close();
            });

            // when
            channel.pipeline().fireChannelRead(bytes(block("Event: First") + block("Event: Second")));

            // then
            assertThat(received).containsExactly("First");
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
        }

        @Test
        void shouldCloseWhenPeerClosesChannel() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            sendAndReadId("Ping", futures);
            AtomicInteger closes = new AtomicInteger();
            connection.onClose(closes::incrementAndGet);

            // when
            channel.close();

            // then
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
            assertThat(failureOf(futures.get(0))).isInstanceOf(AmiConnectionClosedException.class);
            assertThat(closes).hasValue(1);
            assertThat(connection.closeFuture()).isCompleted();
        }

        @Test
        void shouldReportTransportErrorAndClose() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            sendAndReadId("Ping", futures);
            List<Throwable> errors = new ArrayList<>();
            connection.onError(errors::add);
            IOException reset = new IOException("Connection reset by peer");

            // when
            channel.pipeline().fireExceptionCaught(reset);

            // then
            assertThat(errors).containsExactly(reset);
            assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSED);
            assertThat(failureOf(futures.get(0)))
                    .isInstanceOf(AmiConnectionClosedException.class)
                    .hasCause(reset);
        }

        @Test
        void shouldFailActionWhoseWriteFails() {
            // given
            IOException broken = new IOException("Broken pipe");
            channel.pipeline().addFirst(new ChannelOutboundHandlerAdapter() {
                @Override
                public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                    promise.setFailure(broken);
                }
            });

            // when
            CompletableFuture<Response> future = connection.queue(Action.of("Ping"));

            // then
            assertThat(failureOf(future))
                    .isInstanceOf(AmiConnectionException.class)
                    .hasMessage("Failed to send action Ping")
                    .hasCause(broken);
            assertThat(channel.outboundMessages()).isEmpty();
            assertThat(connection.isOpen()).isTrue();
        }

        @Test
        void shouldKeepProtocolErrorsApartFromTransportErrors() {
            // given
            List<CompletableFuture<Response>> futures = new ArrayList<>();
            String id = sendAndReadId("Originate", futures);
            List<Throwable> errors = new ArrayList<>();
            connection.onError(errors::add);

            // when
            receive(block("Response: Error", "ActionID: " + id, "Message: Originate failed"));

            // then
            assertThat(failureOf(futures.get(0))).isInstanceOf(AmiResponseException.class);
            assertThat(errors).isEmpty();
            assertThat(connection.isOpen()).isTrue();
        }
    }

    @Test
    void shouldRejectNullAction() {
        assertThatThrownBy(() -> connection.queue(null)).isInstanceOf(NullPointerException.class);
    }
}
