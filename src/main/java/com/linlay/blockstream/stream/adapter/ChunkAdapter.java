package com.linlay.blockstream.stream.adapter;

import com.linlay.blockstream.cache.ContinuationCapture;
import com.linlay.blockstream.cancel.CancelReason;
import com.linlay.blockstream.cancel.CancellationSignal;
import com.linlay.blockstream.cancel.IdleAbortTimer;
import com.linlay.blockstream.stream.model.Chunk;
import com.linlay.blockstream.stream.model.ErrorKind;
import com.linlay.blockstream.stream.model.IdleTimeoutMessage;
import com.linlay.blockstream.stream.model.ReadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns one provider stream into an ordered, provider-agnostic chunk sequence.
 * <p>
 * Every read resets the idle timer before the event is translated. The emitted sequence always
 * ends with exactly one {@link Chunk.Finish}: the provider's own finish reason on a clean run,
 * {@code error} after a reader failure or a malformed finish, {@code aborted} after cancellation
 * (preceded by a timeout error chunk when the idle timer fired). The reader is released and the
 * timer disarmed on every exit path.
 * <p>
 * One instance serves one stream.
 */
public class ChunkAdapter<R> {

    private static final Logger log = LoggerFactory.getLogger(ChunkAdapter.class);

    private final RawEventTranslator<R> translator;
    private final CancellationSignal cancellation;
    private final IdleAbortTimer idleTimer;
    private final List<ContinuationCapture> captures;
    private final Settings settings;

    public ChunkAdapter(
            RawEventTranslator<R> translator,
            CancellationSignal cancellation,
            IdleAbortTimer idleTimer,
            List<ContinuationCapture> captures,
            Settings settings
    ) {
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
        this.idleTimer = Objects.requireNonNull(idleTimer, "idleTimer must not be null");
        this.captures = captures == null ? List.of() : List.copyOf(captures);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public Flux<Chunk> processStream(ProviderStreamReader<R> reader, Mono<String> finalText) {
        Objects.requireNonNull(reader, "reader must not be null");
        return Flux.defer(() -> {
            StreamState state = new StreamState();
            Disposable disarmOnCancel = cancellation.whenCancelled().subscribe(reason -> idleTimer.disarm());
            idleTimer.arm(settings.idleTimeoutMs(), () -> {
                if (cancellation.cancel(CancelReason.IDLE_TIMEOUT)) {
                    log.warn("[{}] no provider event for {} ms, cancelling stream",
                            settings.messageId(), settings.idleTimeoutMs());
                }
            });

            Flux<Chunk> body = Mono.defer(reader::read)
                    .repeat()
                    .takeUntilOther(Flux.merge(
                            cancellation.whenCancelled().map(reason -> Boolean.TRUE),
                            state.halt.asMono()
                    ))
                    .doOnNext(result -> idleTimer.reset())
                    .takeWhile(result -> !result.done())
                    .concatMapIterable(result -> onRawEvent(result, state), 1)
                    .onErrorResume(ex -> readerFailure(ex, state));

            return Flux.concat(body, Flux.defer(() -> tail(state, finalText)))
                    .doFinally(signal -> {
                        disarmOnCancel.dispose();
                        idleTimer.disarm();
                        reader.release();
                        log.debug("[{}] provider stream settled signal={}", settings.messageId(), signal);
                    });
        });
    }

    private List<Chunk> onRawEvent(ReadResult<R> result, StreamState state) {
        if (state.halted) {
            return List.of();
        }
        R rawEvent = result.value();
        if (log.isDebugEnabled()) {
            log.debug("[{}][raw-event] {}", settings.messageId(), RawEventLogSanitizer.maskText(rawEvent));
        }
        if (translator.isAbort(rawEvent)) {
            state.halted = true;
            cancellation.cancel(CancelReason.PROVIDER_ABORT);
            return List.of();
        }

        List<Chunk> translated;
        try {
            translated = translator.translate(rawEvent);
        } catch (ProtocolException ex) {
            log.warn("[{}] malformed provider event terminal={}: {}", settings.messageId(), ex.isTerminal(), ex.getMessage());
            if (ex.isTerminal()) {
                state.halted = true;
                state.malformedFinish = true;
                state.halt.tryEmitValue(Boolean.TRUE);
            }
            return List.of(new Chunk.Error(ErrorKind.PROTOCOL, ex.getMessage()));
        } catch (RuntimeException ex) {
            log.warn("[{}] failed to translate provider event", settings.messageId(), ex);
            return List.of(new Chunk.Error(ErrorKind.PROTOCOL, String.valueOf(ex.getMessage())));
        }

        List<Chunk> emitted = new ArrayList<>(translated.size());
        for (Chunk chunk : translated) {
            if (chunk instanceof Chunk.Finish finish) {
                // held back until the consistency pass has run
                state.pendingFinish = finish;
                continue;
            }
            if (chunk instanceof Chunk.TextDelta textDelta) {
                state.text.append(textDelta.text());
            }
            if (chunk instanceof Chunk.Raw raw) {
                captureContinuation(raw);
            }
            emitted.add(chunk);
        }
        return emitted;
    }

    private void captureContinuation(Chunk.Raw raw) {
        for (ContinuationCapture capture : captures) {
            try {
                if (capture.capture(settings.conversationId(), raw)) {
                    log.debug("[{}] continuation captured provider={}", settings.messageId(), capture.providerTag());
                }
            } catch (RuntimeException ex) {
                log.warn("[{}] continuation capture failed provider={}", settings.messageId(), capture.providerTag(), ex);
            }
        }
    }

    private Flux<Chunk> readerFailure(Throwable ex, StreamState state) {
        if (cancellation.isCancelled()) {
            return Flux.empty();
        }
        log.warn("[{}] provider stream failed", settings.messageId(), ex);
        state.failed = true;
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return Flux.just(new Chunk.Error(ErrorKind.PROVIDER, message));
    }

    private Flux<Chunk> tail(StreamState state, Mono<String> finalText) {
        if (cancellation.isCancelled() || state.failed || state.malformedFinish || finalText == null) {
            return Flux.defer(() -> Flux.fromIterable(terminalChunks(state)));
        }
        return finalText
                .takeUntilOther(cancellation.whenCancelled())
                .onErrorResume(ex -> {
                    log.warn("[{}] final text unavailable, skipping consistency pass", settings.messageId(), ex);
                    return Mono.empty();
                })
                .flatMapIterable(text -> consistencyChunks(text, state))
                .concatWith(Flux.defer(() -> Flux.fromIterable(terminalChunks(state))));
    }

    private List<Chunk> consistencyChunks(String finalText, StreamState state) {
        if (finalText == null || finalText.isEmpty() || cancellation.isCancelled()) {
            return List.of();
        }
        String streamed = state.text.toString();
        if (finalText.equals(streamed)) {
            return List.of();
        }
        if (finalText.startsWith(streamed)) {
            String missing = finalText.substring(streamed.length());
            state.text.append(missing);
            log.debug("[{}] consistency pass appended {} chars", settings.messageId(), missing.length());
            return List.of(new Chunk.TextDelta(missing));
        }
        log.warn("[{}] final text diverges from streamed deltas (streamed={}, final={}), keeping streamed text",
                settings.messageId(), streamed.length(), finalText.length());
        return List.of();
    }

    private List<Chunk> terminalChunks(StreamState state) {
        CancelReason reason = cancellation.reason();
        if (reason == CancelReason.IDLE_TIMEOUT) {
            long timeoutMs = settings.idleTimeoutMs();
            return List.of(
                    new Chunk.Error(
                            ErrorKind.TIMEOUT,
                            IdleTimeoutMessage.format(settings.timeoutMessageTemplate(), timeoutMs),
                            timeoutMs
                    ),
                    new Chunk.Finish(Chunk.Finish.ABORTED)
            );
        }
        if (reason != null) {
            return List.of(new Chunk.Finish(Chunk.Finish.ABORTED));
        }
        if (state.failed || state.malformedFinish) {
            return List.of(new Chunk.Finish(Chunk.Finish.ERROR));
        }
        return List.of(state.pendingFinish != null ? state.pendingFinish : new Chunk.Finish(Chunk.Finish.STOP));
    }

    public record Settings(
            String messageId,
            String conversationId,
            long idleTimeoutMs,
            String timeoutMessageTemplate
    ) {
        public Settings {
            if (messageId == null || messageId.isBlank()) {
                throw new IllegalArgumentException("messageId must not be blank");
            }
        }
    }

    private static final class StreamState {
        private final StringBuilder text = new StringBuilder();
        private final Sinks.One<Boolean> halt = Sinks.one();
        private Chunk.Finish pendingFinish;
        private boolean halted;
        private boolean failed;
        private boolean malformedFinish;
    }
}
