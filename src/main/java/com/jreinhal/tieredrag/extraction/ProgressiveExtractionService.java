package com.jreinhal.tieredrag.extraction;

import com.jreinhal.tieredrag.config.ExtractionProperties;
import com.jreinhal.tieredrag.extraction.quality.QualityReport;
import com.jreinhal.tieredrag.extraction.quality.QualityScorer;
import com.jreinhal.tieredrag.reasoning.ReasoningStep;
import com.jreinhal.tieredrag.reasoning.TraceSink;
import com.jreinhal.tieredrag.util.LogSanitizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives extraction through the enabled tiers, cheapest first, until one meets the target
 * quality or the tiers run out.
 *
 * <p>Tiers run strictly one after another: the decision to escalate needs the previous
 * tier's score. Each attempt runs on the extraction pool so it can be bounded by the tier's
 * deadline and interrupted on cancellation. A tier failure is recorded and the next tier is
 * tried; low quality is never a failure. Only when every tier fails does the call throw
 * {@link AllTiersExhaustedException}.</p>
 */
@Service
public class ProgressiveExtractionService {
    private static final Logger log = LoggerFactory.getLogger(ProgressiveExtractionService.class);

    private final List<ExtractionTierClient> clients;
    private final QualityScorer qualityScorer;
    private final ExtractionProperties properties;
    private final ExecutorService executor;

    public ProgressiveExtractionService(List<ExtractionTierClient> clients, QualityScorer qualityScorer,
                                        ExtractionProperties properties,
                                        @Qualifier("extractionExecutor") ExecutorService executor) {
        this.clients = List.copyOf(clients);
        this.qualityScorer = qualityScorer;
        this.properties = properties;
        this.executor = executor;
    }

    public double defaultTargetQuality() {
        return properties.getTargetQuality();
    }

    public ExtractionResult extract(ExtractionRequest request, CancellationSignal cancellation, TraceSink trace) {
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
        TraceSink sink = TraceSink.orNoop(trace);
        List<TierSettings> plan = plan(request);
        String filename = LogSanitizer.sanitize(request.filename());

        ExtractionAttempt best = null;
        List<ExtractionAttempt> attempts = new ArrayList<>();
        List<ExtractionTier> tiersTried = new ArrayList<>();
        Map<ExtractionTier, String> failures = new LinkedHashMap<>();
        String reason = null;

        for (int i = 0; i < plan.size(); i++) {
            if (signal.isCancelled()) {
                break;
            }
            TierSettings settings = plan.get(i);
            ExtractionTier tier = settings.tier();
            tiersTried.add(tier);
            long start = System.nanoTime();
            TierOutput output;
            try {
                output = runTier(request, settings, signal);
            } catch (ExtractionFailedException e) {
                String failure = e.category() + ": " + e.getMessage();
                failures.put(tier, failure);
                log.warn("Extraction tier {} failed for {}: {}", tier, filename, failure);
                sink.step(ReasoningStep.StepType.ERROR, "Tier " + tier + " failed", failure, elapsedMs(start));
                if (i + 1 < plan.size()) {
                    sink.step(ReasoningStep.StepType.ESCALATION, "Escalating to " + plan.get(i + 1).tier(),
                            tier + " " + e.category(), 0L, escalationData(plan.get(i + 1)));
                }
                continue;
            } catch (CancellationException e) {
                log.info("Extraction of {} cancelled during tier {}", filename, tier);
                break;
            }

            Duration duration = output.duration().isZero() ? Duration.ofNanos(System.nanoTime() - start) : output.duration();
            long scoreStart = System.nanoTime();
            QualityReport quality = qualityScorer.score(output.pages());
            ExtractionAttempt attempt = new ExtractionAttempt(tier, output.pages(), duration, output.cost(), quality);
            attempts.add(attempt);
            sink.step(ReasoningStep.StepType.TIER_ATTEMPT, "Tier " + tier,
                    output.pages().size() + " pages", duration.toMillis(),
                    Map.of("tier", tier.name(), "pages", output.pages().size(), "cost", output.cost()));
            sink.step(ReasoningStep.StepType.QUALITY_SCORING, "Quality " + tier,
                    String.format(Locale.ROOT, "%.3f (%s)", attempt.score(), quality.recommendation().label()),
                    elapsedMs(scoreStart), Map.of("score", attempt.score(), "issues", quality.issues()));
            log.info("Extraction tier {} for {}: {} pages, quality={}, cost=${}",
                    tier, filename, output.pages().size(), String.format(Locale.ROOT, "%.3f", attempt.score()),
                    String.format(Locale.ROOT, "%.5f", output.cost()));

            if (best == null || attempt.score() > best.score()) {
                best = attempt;
            }
            if (attempt.score() >= request.targetQuality()) {
                reason = "met target at tier " + tier;
                break;
            }
            if (i + 1 < plan.size()) {
                sink.step(ReasoningStep.StepType.ESCALATION, "Escalating to " + plan.get(i + 1).tier(),
                        String.format(Locale.ROOT, "%s scored %.3f below target %.2f", tier, attempt.score(),
                                request.targetQuality()), 0L, escalationData(plan.get(i + 1)));
            }
        }

        boolean cancelled = signal.isCancelled();
        if (best == null) {
            if (cancelled) {
                throw new ExtractionCancelledException("Extraction of " + filename + " cancelled before any tier produced text");
            }
            log.error("All extraction tiers failed for {}: {}", filename, failures);
            throw new AllTiersExhaustedException(failures);
        }
        if (reason == null) {
            reason = cancelled
                    ? "cancelled after " + tiersTried.size() + " tier(s), returning best of " + attempts.size()
                    : "exhausted all tiers, returning best of " + attempts.size();
        }
        sink.metric("selected_tier", best.tier().name());
        sink.metric("quality_score", best.score());
        ExtractionResult result = new ExtractionResult(best, attempts, tiersTried, failures, reason, cancelled);
        sink.metric("extraction_cost", result.totalCost());
        log.info("Extraction of {} selected tier {} (quality={}): {}", filename, best.tier(),
                String.format(Locale.ROOT, "%.3f", best.score()), reason);
        return result;
    }

    private List<TierSettings> plan(ExtractionRequest request) {
        List<TierSettings> plan = new ArrayList<>();
        for (TierSettings settings : properties.enabledTiers()) {
            if (request.tiersEnabled() == null || request.tiersEnabled().contains(settings.tier())) {
                plan.add(settings);
            }
        }
        if (plan.isEmpty()) {
            throw new IllegalArgumentException("No enabled extraction tiers match the request");
        }
        return plan;
    }

    /**
     * Runs one tier on the extraction pool and waits for it within the tier's deadline.
     *
     * @throws CancellationException if the caller cancelled while the tier was running
     */
    private TierOutput runTier(ExtractionRequest request, TierSettings settings, CancellationSignal signal) {
        ExtractionTier tier = settings.tier();
        ExtractionTierClient client = clientFor(tier);
        Future<TierOutput> future;
        try {
            future = executor.submit(() -> client.extract(request.content(), request.filename(), settings));
        } catch (RejectedExecutionException e) {
            throw new TierUnavailableException(tier, "extraction pool saturated", e);
        }
        Runnable unregister = signal.onCancel(() -> future.cancel(true));
        long deadlineMs = settings.timeout().toMillis() * settings.backoff().maxAttempts()
                + settings.backoff().maxTotalDelay().toMillis();
        try {
            TierOutput output = future.get(deadlineMs, TimeUnit.MILLISECONDS);
            if (output == null || output.pages().stream().allMatch(page -> page == null || page.isBlank())) {
                throw new ExtractionEmptyException(tier, "no text returned");
            }
            return output;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TierUnavailableException(tier, "timed out after " + deadlineMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionFailedException failed) {
                throw failed;
            }
            throw new TierUnavailableException(tier, cause != null ? cause.getMessage() : "extraction failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            signal.cancel();
            throw new CancellationException("interrupted");
        } finally {
            unregister.run();
        }
    }

    private ExtractionTierClient clientFor(ExtractionTier tier) {
        for (ExtractionTierClient client : clients) {
            if (client.supports(tier)) {
                return client;
            }
        }
        throw new TierUnavailableException(tier, "no client registered for tier");
    }

    private static Map<String, Object> escalationData(TierSettings next) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("nextTier", next.tier().configKey());
        data.put("costPerPage", next.costPerPage());
        data.put("expectedQualityCeiling", next.qualityCeiling());
        return data;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
