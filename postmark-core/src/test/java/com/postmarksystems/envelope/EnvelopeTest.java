package com.postmarksystems.envelope;

import com.postmarksystems.ActorContext;
import com.postmarksystems.ActorExitStatus;
import com.postmarksystems.handler.Handler;
import com.postmarksystems.helper.Counter;
import com.postmarksystems.helper.CounterProtocol.GetCount;
import com.postmarksystems.helper.CounterProtocol.Fail;
import com.postmarksystems.helper.CounterProtocol.Increment;
import com.postmarksystems.reply.NoReplyException;
import com.postmarksystems.reply.Result;
import com.postmarksystems.scheduler.Scheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for wrapping, introspecting and dispatching envelopes.
 */
class EnvelopeTest {

    private Counter counter;
    private ActorContext<Counter> context;

    @BeforeEach
    void setUp() {
        counter = new Counter(10);
        context = new ActorContext<>("counter", new Scheduler());
    }

    @Test
    void testDispatchSendsReply() {
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(5), Counter.INCREMENT);

        wrapped.envelope().dispatch(counter, context).join();

        assertEquals(15, wrapped.receiver().get());
        assertEquals(15, counter.count);
    }

    @Test
    void testSecondDispatchIsContractViolation() {
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(5), Counter.INCREMENT);
        Envelope<Counter> envelope = wrapped.envelope();
        envelope.dispatch(counter, context).join();

        assertThrows(EnvelopeConsumedException.class, () -> envelope.dispatch(counter, context));

        assertEquals(15, counter.count, "handler must not run a second time");
        assertEquals(15, wrapped.receiver().get());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testHandlerInvokedExactlyOnce() throws Exception {
        Handler<Counter, Increment, Integer> handler = mock(Handler.class);
        when(handler.handle(any(), any(), any())).thenReturn(CompletableFuture.completedFuture(42));
        Increment message = new Increment(1);
        Envelope<Counter> envelope = Envelopes.wrap(message, handler).envelope();

        envelope.dispatch(counter, context).join();
        assertThrows(EnvelopeConsumedException.class, () -> envelope.dispatch(counter, context));

        verify(handler, times(1)).handle(same(counter), eq(message), same(context));
    }

    @Test
    void testTypedExtractionConsumesMessage() {
        Envelope<Counter> envelope = Envelopes.wrap(new Increment(5), Counter.INCREMENT).envelope();

        assertEquals(Optional.of(new Increment(5)), envelope.message(Increment.class));
        assertEquals(Optional.empty(), envelope.message(Increment.class));
        assertTrue(envelope.isConsumed());
    }

    @Test
    void testTypedExtractionWithWrongTypeIsEmpty() {
        Envelope<Counter> envelope = Envelopes.wrap(new Increment(5), Counter.INCREMENT).envelope();

        assertEquals(Optional.empty(), envelope.message(GetCount.class));
        // The mismatching call still took the message out.
        assertEquals(Optional.empty(), envelope.message(Increment.class));
    }

    @Test
    void testOpaqueExtraction() {
        Envelope<Counter> envelope = Envelopes.wrap(new Increment(7), Counter.INCREMENT).envelope();

        Optional<Object> message = envelope.message();
        assertTrue(message.isPresent());
        assertInstanceOf(Increment.class, message.get());
        assertTrue(envelope.message().isEmpty());
    }

    @Test
    void testExtractionDropsReplySender() {
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(5), Counter.INCREMENT);

        wrapped.envelope().message();

        assertThrows(NoReplyException.class, () -> wrapped.receiver().get());
    }

    @Test
    void testDispatchAfterExtractionIsContractViolation() {
        Envelope<Counter> envelope = Envelopes.wrap(new Increment(5), Counter.INCREMENT).envelope();
        envelope.message();

        assertThrows(EnvelopeConsumedException.class, () -> envelope.dispatch(counter, context));
        assertEquals(10, counter.count);
    }

    @Test
    @Timeout(5)
    void testDispatchWithDroppedReceiver() {
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(5), Counter.INCREMENT);
        wrapped.receiver().drop();

        CompletableFuture<Void> handled = wrapped.envelope().dispatch(counter, context);

        assertDoesNotThrow(() -> handled.join());
        assertEquals(15, counter.count);
        assertTrue(wrapped.receiver().future().isCancelled());
    }

    @Test
    void testDebugRepresentation() {
        Envelope<Counter> envelope = Envelopes.wrap(new Increment(5), Counter.INCREMENT).envelope();
        assertEquals("Envelope(Increment[amount=5])", envelope.toString());
        // Reading the debug text does not consume anything.
        assertEquals("Envelope(Increment[amount=5])", envelope.toString());

        envelope.dispatch(counter, context).join();
        assertEquals("Envelope(<consumed>)", envelope.toString());
    }

    @Test
    void testDebugRepresentationAfterExtraction() {
        Envelope<Counter> envelope = Envelopes.wrap(new Increment(5), Counter.INCREMENT).envelope();
        envelope.message();

        assertTrue(envelope.toString().contains(Envelope.CONSUMED_MARKER));
    }

    @Test
    void testDebugRepresentationSurvivesFailingToString() {
        Object unprintable = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("cannot print");
            }
        };
        Envelope<Counter> envelope = Envelopes.wrap(unprintable,
            Handler.<Counter, Object, Object>sync((actor, msg, ctx) -> msg)).envelope();

        String text = assertDoesNotThrow(envelope::toString);
        assertTrue(text.startsWith("Envelope("));
        assertTrue(text.contains("toString failed"));
        assertFalse(envelope.isConsumed());
    }

    @Test
    void testTypedExtractionWithPrimitiveClass() {
        Envelope<Counter> envelope = Envelopes.wrap(42,
            Handler.<Counter, Integer, Integer>sync((actor, msg, ctx) -> msg)).envelope();

        assertEquals(Optional.of(42), envelope.message(int.class));
        assertEquals(Optional.empty(), envelope.message(int.class));
    }

    @Test
    void testTypedExtractionWithMismatchingPrimitiveClass() {
        Envelope<Counter> envelope = Envelopes.wrap(42,
            Handler.<Counter, Integer, Integer>sync((actor, msg, ctx) -> msg)).envelope();

        assertEquals(Optional.empty(), envelope.message(long.class));
        assertTrue(envelope.isConsumed());
    }

    @Test
    void testHandlerFailureIsPropagated() {
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Fail("boom"), Counter.FAIL);

        CompletableFuture<Void> handled = wrapped.envelope().dispatch(counter, context);

        CompletionException thrown = assertThrows(CompletionException.class, handled::join);
        ActorExitStatus status = assertInstanceOf(ActorExitStatus.class, thrown.getCause());
        assertEquals(ActorExitStatus.Kind.FAILURE, status.getKind());
        assertEquals("boom", status.getMessage());

        Result<Integer> reply = wrapped.receiver().await(Duration.ofSeconds(1));
        assertFalse(reply.isSuccess());
        reply.ifFailure(error -> assertInstanceOf(NoReplyException.class, error));
    }

    @Test
    void testAsyncFailureIsPropagatedUnwrapped() {
        ActorExitStatus quit = ActorExitStatus.quit();
        Handler<Counter, Increment, Integer> handler =
            (actor, msg, ctx) -> CompletableFuture.supplyAsync(() -> {
                throw new CompletionException(quit);
            });
        Envelope<Counter> envelope = Envelopes.wrap(new Increment(1), handler).envelope();

        CompletionException thrown = assertThrows(CompletionException.class,
            () -> envelope.dispatch(counter, context).join());
        assertSame(quit, thrown.getCause());
    }

    @Test
    void testUncheckedHandlerErrorIsPropagated() {
        Handler<Counter, Increment, Integer> handler = (actor, msg, ctx) -> {
            throw new IllegalArgumentException("bad increment");
        };
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(1), handler);

        CompletionException thrown = assertThrows(CompletionException.class,
            () -> wrapped.envelope().dispatch(counter, context).join());
        assertInstanceOf(IllegalArgumentException.class, thrown.getCause());
        assertThrows(NoReplyException.class, () -> wrapped.receiver().get());
    }

    @Test
    @Timeout(5)
    void testHandlerThrowingErrorResolvesReceiver() {
        Handler<Counter, Increment, Integer> handler = (actor, msg, ctx) -> {
            throw new AssertionError("boom");
        };
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(1), handler);

        CompletableFuture<Void> handled;
        try (Envelope<Counter> envelope = wrapped.envelope()) {
            handled = envelope.dispatch(counter, context);
        }

        CompletionException thrown = assertThrows(CompletionException.class, handled::join);
        assertInstanceOf(AssertionError.class, thrown.getCause());
        assertTrue(wrapped.receiver().isDone());
        Result<Integer> reply = wrapped.receiver().await(Duration.ofSeconds(1));
        reply.ifFailure(error -> assertInstanceOf(NoReplyException.class, error));
        assertFalse(reply.isSuccess());
    }

    @Test
    @Timeout(5)
    void testAsynchronousHandler() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Handler<Counter, Increment, Integer> slowIncrement = (actor, msg, ctx) ->
                CompletableFuture.supplyAsync(() -> {
                    actor.count += msg.amount();
                    return actor.count;
                }, CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS, executor));
            WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(5), slowIncrement);

            CompletableFuture<Void> handled = wrapped.envelope().dispatch(counter, context);
            assertTrue(wrapped.envelope().isConsumed());
            assertFalse(wrapped.receiver().isDone());

            handled.get(2, TimeUnit.SECONDS);
            assertEquals(15, wrapped.receiver().get(Duration.ofSeconds(1)));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testCloseBeforeDispatchResolvesReceiverToNoReply() {
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(5), Counter.INCREMENT);

        wrapped.envelope().close();

        assertTrue(wrapped.envelope().isConsumed());
        assertThrows(NoReplyException.class, () -> wrapped.receiver().get());
        assertThrows(EnvelopeConsumedException.class, () -> wrapped.envelope().dispatch(counter, context));
        assertEquals(10, counter.count);
    }

    @Test
    void testCloseAfterDispatchKeepsReply() {
        WrappedEnvelope<Counter, Integer> wrapped = Envelopes.wrap(new Increment(5), Counter.INCREMENT);
        try (Envelope<Counter> envelope = wrapped.envelope()) {
            envelope.dispatch(counter, context).join();
        }

        assertEquals(15, wrapped.receiver().get());
    }

    @Test
    void testHeterogeneousEnvelopesShareOneQueueType() {
        WrappedEnvelope<Counter, Integer> increment = Envelopes.wrap(new Increment(5), Counter.INCREMENT);
        WrappedEnvelope<Counter, String> describe = Envelopes.wrap("label",
            Handler.<Counter, String, String>sync((actor, msg, ctx) -> msg + "=" + actor.count));
        WrappedEnvelope<Counter, Integer> get = Envelopes.wrap(new GetCount(), Counter.GET_COUNT);

        List<Envelope<Counter>> queue = List.of(increment.envelope(), describe.envelope(), get.envelope());
        for (Envelope<Counter> envelope : queue) {
            envelope.dispatch(counter, context).join();
        }

        assertEquals(15, increment.receiver().get());
        assertEquals("label=15", describe.receiver().get());
        assertEquals(15, get.receiver().get());
    }

    @Test
    void testWrapRejectsNull() {
        assertThrows(NullPointerException.class, () -> Envelopes.wrap(null, Counter.INCREMENT));
        assertThrows(NullPointerException.class,
            () -> Envelopes.<Counter, Increment, Integer>wrap(new Increment(1), null));
    }
}
