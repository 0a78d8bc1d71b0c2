package net.closetcapture.service.processing;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import net.closetcapture.config.ProcessingProperties;
import net.closetcapture.config.SchedulerConfig;
import net.closetcapture.exception.ProcessingErrorCode;
import net.closetcapture.exception.ProcessingException;
import net.closetcapture.model.image.CompressedImage;
import net.closetcapture.model.image.CompressionProfile;
import net.closetcapture.model.processing.ProcessingRequest;
import net.closetcapture.model.processing.ProcessingResult;
import net.closetcapture.service.image.ImageCompressionService;
import net.closetcapture.service.image.ImagePayloadEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

/**
 * Drives one logical processing action from raw bytes to a {@link ProcessingResult}.
 *
 * <p>Flow:
 * <ol>
 *   <li>compress with the submission profile and base64-encode, once per action</li>
 *   <li>send the request, racing each attempt against the timeout and the cancellation token</li>
 *   <li>re-issue the identical request on transient failures while the retry budget lasts</li>
 * </ol>
 * Cancellation takes precedence over any concurrently arriving timeout, failure or response.
 * Every failure handed back is a {@link ProcessingException} with {@code retryable == false}.</p>
 */
@Service
public class ProcessingClient {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingClient.class);

    private final ProcessingEndpoint endpoint;
    private final BearerTokenProvider bearerTokenProvider;
    private final ImageCompressionService compressionService;
    private final ImagePayloadEncoder payloadEncoder;
    private final ProcessingResponseHandler responseHandler;
    private final IdempotencyKeyGenerator keyGenerator;
    private final Scheduler ioScheduler;
    private final Scheduler timerScheduler;
    private final CompressionProfile submissionProfile;
    private final RetryPolicy retryPolicy;
    private final Duration attemptTimeout;

    public ProcessingClient(ProcessingEndpoint endpoint,
                            BearerTokenProvider bearerTokenProvider,
                            ImageCompressionService compressionService,
                            ImagePayloadEncoder payloadEncoder,
                            ProcessingResponseHandler responseHandler,
                            IdempotencyKeyGenerator keyGenerator,
                            ProcessingProperties processingProperties,
                            @Qualifier(SchedulerConfig.IO_SCHEDULER) Scheduler ioScheduler,
                            @Qualifier(SchedulerConfig.TIMER_SCHEDULER) Scheduler timerScheduler) {
        this.endpoint = endpoint;
        this.bearerTokenProvider = bearerTokenProvider;
        this.compressionService = compressionService;
        this.payloadEncoder = payloadEncoder;
        this.responseHandler = responseHandler;
        this.keyGenerator = keyGenerator;
        this.ioScheduler = ioScheduler;
        this.timerScheduler = timerScheduler;
        this.submissionProfile = new CompressionProfile(
            processingProperties.getSubmissionMaxEdge(), processingProperties.getSubmissionQuality());
        this.retryPolicy = RetryPolicy.transientFailures(processingProperties.getMaxRetries());
        this.attemptTimeout = processingProperties.getTimeout();
    }

    /**
     * Starts a new logical action with a fresh idempotency key.
     */
    public ProcessingRun newRun(String ownerId, CancellationToken token) {
        return new ProcessingRun(ownerId, keyGenerator.nextKey(), token);
    }

    /**
     * Convenience for callers that do not need to inspect the prepared submission.
     */
    public Mono<ProcessingResult> process(byte[] rawBytes, String mimeType, String ownerId, CancellationToken token) {
        return Mono.defer(() -> process(rawBytes, mimeType, newRun(ownerId, token)));
    }

    public Mono<ProcessingResult> process(byte[] rawBytes, String mimeType, ProcessingRun run) {
        return prepare(rawBytes, mimeType, run).flatMap(prepared -> submit(prepared, run));
    }

    /**
     * Compresses and encodes on the I/O scheduler. Runs once per action; retries reuse the result.
     */
    public Mono<PreparedSubmission> prepare(byte[] rawBytes, String mimeType, ProcessingRun run) {
        CancellationToken token = run.cancellationToken();
        return Mono.fromCallable(() -> {
                ensureNotCancelled(token);
                run.transitionTo(ProcessingPhase.COMPRESSING);
                CompressedImage compressed = compressionService.compress(
                    rawBytes, mimeType, submissionProfile, run.idempotencyKey());
                if (compressed.fallbackToOriginal()) {
                    run.markCompressionFallback();
                    logger.warn("Run {}: submission compression fell back to original bytes ({}).",
                        run.idempotencyKey(), compressed.failureDetail());
                }

                ensureNotCancelled(token);
                run.transitionTo(ProcessingPhase.ENCODING);
                String payload = payloadEncoder.encode(compressed.bytes());

                ensureNotCancelled(token);
                ProcessingRequest request = new ProcessingRequest(
                    payload, run.ownerId(), compressed.mimeType(), run.idempotencyKey());
                logger.debug("Run {}: prepared {} ({} bytes encoded).", run.idempotencyKey(), request, compressed.size());
                return new PreparedSubmission(request, compressed);
            })
            .subscribeOn(ioScheduler)
            .onErrorMap(error -> toTerminal(error, token))
            .doOnError(error -> markTerminalFailure(run, error));
    }

    /**
     * Sends a prepared request, retrying transient failures with the identical body and key.
     */
    public Mono<ProcessingResult> submit(PreparedSubmission prepared, ProcessingRun run) {
        CancellationToken token = run.cancellationToken();
        ProcessingRequest request = prepared.request();

        Mono<ProcessingResult> attempt = Mono.defer(() -> {
            if (token.isCancelled()) {
                return Mono.error(ProcessingException.cancelled());
            }
            int attemptNumber = run.beginAttempt();
            logger.debug("Run {}: attempt {}/{}.", request.idempotencyKey(), attemptNumber, retryPolicy.maxAttempts());

            Mono<ProcessingResult> call = bearerTokenProvider.bearerToken()
                .switchIfEmpty(Mono.error(() -> ProcessingException.of(
                    ProcessingErrorCode.AUTH_EXPIRED, "No bearer token available")))
                .flatMap(bearer -> endpoint.invoke(request, bearer))
                .map(responseHandler::toResult)
                .timeout(attemptTimeout, timerScheduler)
                .onErrorMap(TimeoutException.class, e -> ProcessingException.of(
                    ProcessingErrorCode.TIMEOUT, "Processing attempt exceeded " + attemptTimeout, e))
                .onErrorMap(e -> !(e instanceof ProcessingException), e -> ProcessingException.of(
                    ProcessingErrorCode.SERVER_ERROR, "Unexpected processing failure: " + e.getMessage(), e));

            Mono<ProcessingResult> cancellation = token.whenCancelled()
                .then(Mono.<ProcessingResult>error(ProcessingException::cancelled));

            return Mono.firstWithSignal(call, cancellation);
        });

        return attempt
            .retryWhen(Retry.max(retryPolicy.maxRetries())
                .filter(error -> !token.isCancelled() && retryPolicy.isRetryable(error))
                .doBeforeRetry(signal -> {
                    run.transitionTo(ProcessingPhase.RETRYING);
                    logger.warn("[code={}] Run {}: attempt {} failed, retrying with the same key: {}",
                        codeOf(signal.failure()), request.idempotencyKey(), signal.totalRetries() + 1,
                        signal.failure().getMessage());
                })
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
            .flatMap(result -> token.isCancelled()
                ? Mono.<ProcessingResult>error(ProcessingException.cancelled())
                : Mono.just(result))
            .onErrorMap(error -> toTerminal(error, token))
            .doOnSuccess(result -> {
                run.transitionTo(ProcessingPhase.SUCCESS);
                logger.info("Run {}: processed asset {} after {} attempt(s) (fallback={}).",
                    request.idempotencyKey(), result.assetId(), run.attempts(), result.usedFallback());
            })
            .doOnError(error -> markTerminalFailure(run, error))
            .doOnCancel(() -> run.transitionTo(ProcessingPhase.CANCELLED));
    }

    private static void ensureNotCancelled(CancellationToken token) {
        if (token.isCancelled()) {
            throw ProcessingException.cancelled();
        }
    }

    private static ProcessingException toTerminal(Throwable error, CancellationToken token) {
        if (token.isCancelled()) {
            return error instanceof ProcessingException pe && pe.getErrorCode() == ProcessingErrorCode.CANCELLED
                ? pe
                : new ProcessingException(ProcessingErrorCode.CANCELLED, "Processing cancelled", false, error);
        }
        if (error instanceof ProcessingException processingException) {
            return processingException.asTerminal();
        }
        return new ProcessingException(ProcessingErrorCode.SERVER_ERROR,
            "Unexpected processing failure: " + error.getMessage(), false, error);
    }

    private static void markTerminalFailure(ProcessingRun run, Throwable error) {
        ProcessingErrorCode code = codeOf(error);
        if (code == ProcessingErrorCode.CANCELLED) {
            run.transitionTo(ProcessingPhase.CANCELLED);
            logger.info("Run {}: cancelled.", run.idempotencyKey());
            return;
        }
        run.transitionTo(ProcessingPhase.FAILED);
        logger.error("[code={}] Run {}: processing failed after {} attempt(s): {}",
            code == null ? "UNKNOWN" : code.code(), run.idempotencyKey(), run.attempts(), error.getMessage());
    }

    private static ProcessingErrorCode codeOf(Throwable error) {
        return error instanceof ProcessingException processingException ? processingException.getErrorCode() : null;
    }
}
