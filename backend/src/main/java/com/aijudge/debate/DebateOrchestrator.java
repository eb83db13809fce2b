package com.aijudge.debate;

import com.aijudge.model.AgentKind;
import com.aijudge.model.Argument;
import com.aijudge.model.DebateRound;
import com.aijudge.model.DebateTranscript;
import com.aijudge.model.VerdictSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Drives one debate: opening, counter and rebuttal rounds, then judging.
 *
 * <p>Rounds are strictly sequential; both calls of a round finish before the next round starts.
 * An exhausted retry budget ends the run with a {@code failed} transcript that keeps every
 * argument produced so far. {@link #run} does not throw for lawyer or judge failures.
 */
public class DebateOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DebateOrchestrator.class);
    private static final List<AgentKind> SEATS = List.of(AgentKind.EMOTIONAL, AgentKind.LOGICAL);

    private final VerdictExtractor verdictExtractor;
    private final RetryExecutor retryExecutor;
    private final Executor agentExecutor;
    private final DebateSettings settings;

    public DebateOrchestrator(
            VerdictExtractor verdictExtractor,
            RetryExecutor retryExecutor,
            Executor agentExecutor,
            DebateSettings settings
    ) {
        this.verdictExtractor = Objects.requireNonNull(verdictExtractor, "verdictExtractor is required");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor is required");
        this.agentExecutor = Objects.requireNonNull(agentExecutor, "agentExecutor is required");
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public DebateTranscript run(
            DebateTranscript initial,
            DebateParticipants participants,
            DebateProgressListener listener
    ) {
        Objects.requireNonNull(initial, "initial transcript is required");
        Objects.requireNonNull(participants, "participants are required");
        DebateProgressListener progress = listener == null ? DebateProgressListener.NONE : listener;
        String caseDescription = initial.caseInput().description();

        DebateTranscript transcript = initial;
        try {
            transcript = runRound(transcript, DebateRound.OPENING, kind ->
                    participants.lawyer(kind).opening(caseDescription), progress);

            DebateTranscript afterOpening = transcript;
            transcript = runRound(transcript, DebateRound.COUNTER, kind ->
                    participants.lawyer(kind).counter(
                            caseDescription,
                            content(afterOpening, DebateRound.OPENING, kind.opponent())
                    ), progress);

            DebateTranscript afterCounter = transcript;
            transcript = runRound(transcript, DebateRound.REBUTTAL, kind ->
                    participants.lawyer(kind).rebuttal(
                            caseDescription,
                            content(afterCounter, DebateRound.COUNTER, kind.opponent()),
                            content(afterCounter, DebateRound.COUNTER, kind)
                    ), progress);

            DebateTranscript completed = judge(transcript, participants, caseDescription);
            log.info(
                    "Debate {} complete: winner={}, emotional={}, logical={}, source={}",
                    completed.debateId(),
                    completed.verdict().winner().wireValue(),
                    completed.verdict().emotionalScore(),
                    completed.verdict().logicalScore(),
                    completed.verdictSource().wireValue()
            );
            notify(progress, completed);
            return completed;
        } catch (DebateStepException ex) {
            return fail(ex.partial(), ex.getCause(), progress);
        } catch (RuntimeException ex) {
            return fail(transcript, ex, progress);
        }
    }

    private DebateTranscript runRound(
            DebateTranscript transcript,
            DebateRound round,
            Function<AgentKind, String> call,
            DebateProgressListener progress
    ) {
        log.debug("Debate {} starting round {} ({})", transcript.debateId(), round.number(), round.label());
        Map<AgentKind, Supplier<Argument>> tasks = new EnumMap<>(AgentKind.class);
        for (AgentKind kind : SEATS) {
            String label = "debate " + transcript.debateId() + " " + kind.wireValue() + " " + round.label();
            tasks.put(kind, () -> retryExecutor.execute(label, settings.callAttempts(), () ->
                    Argument.create(kind, round, call.apply(kind), settings.argumentBand())));
        }

        List<Argument> produced = new ArrayList<>();
        RuntimeException failure = settings.parallelAgents()
                ? runParallel(tasks, produced)
                : runSequential(tasks, produced);

        DebateTranscript next = transcript.withRound(round, produced);
        if (failure != null) {
            throw new DebateStepException(next, failure);
        }
        notify(progress, next);
        return next;
    }

    private RuntimeException runParallel(Map<AgentKind, Supplier<Argument>> tasks, List<Argument> produced) {
        Map<AgentKind, CompletableFuture<Argument>> futures = new EnumMap<>(AgentKind.class);
        tasks.forEach((kind, task) -> futures.put(kind, CompletableFuture.supplyAsync(task, agentExecutor)));

        RuntimeException failure = null;
        for (CompletableFuture<Argument> future : futures.values()) {
            try {
                produced.add(future.join());
            } catch (CompletionException ex) {
                if (failure == null) {
                    failure = unwrap(ex);
                }
            }
        }
        return failure;
    }

    private static RuntimeException runSequential(Map<AgentKind, Supplier<Argument>> tasks, List<Argument> produced) {
        RuntimeException failure = null;
        for (Supplier<Argument> task : tasks.values()) {
            try {
                produced.add(task.get());
            } catch (RuntimeException ex) {
                if (failure == null) {
                    failure = ex;
                }
            }
        }
        return failure;
    }

    private DebateTranscript judge(DebateTranscript transcript, DebateParticipants participants, String caseDescription) {
        List<Argument> arguments = transcript.arguments();
        String raw = retryExecutor.execute(
                "debate " + transcript.debateId() + " judge",
                settings.callAttempts(),
                () -> participants.judge().evaluate(caseDescription, arguments)
        );

        VerdictExtraction extraction = verdictExtractor.extract(raw);
        VerdictSource source = extraction.source();
        if (extraction.isHeuristic() && settings.repairEnabled()) {
            VerdictExtraction repaired = attemptRepair(transcript, participants, raw);
            if (repaired != null) {
                extraction = repaired;
                source = VerdictSource.REFORMATTED;
            }
        }
        if (!extraction.qualityIssues().isEmpty()) {
            log.info("Debate {} verdict quality issues: {}", transcript.debateId(), extraction.qualityIssues());
        }
        return transcript.completed(extraction.verdict(), source);
    }

    private VerdictExtraction attemptRepair(DebateTranscript transcript, DebateParticipants participants, String raw) {
        try {
            VerdictExtraction repaired = verdictExtractor.extract(participants.judge().reformat(raw));
            if (!repaired.isHeuristic() && repaired.scoresParsed()) {
                log.info("Debate {} verdict recovered by reformat request", transcript.debateId());
                return repaired;
            }
            log.warn("Debate {} reformat request did not yield integer scores; keeping heuristic verdict",
                    transcript.debateId());
        } catch (RuntimeException ex) {
            log.warn("Debate {} reformat request failed ({}); keeping heuristic verdict",
                    transcript.debateId(), ex.getMessage());
        }
        return null;
    }

    private DebateTranscript fail(DebateTranscript partial, Throwable cause, DebateProgressListener progress) {
        String message = describe(cause);
        log.error("Debate {} failed: {}", partial.debateId(), message, cause);
        DebateTranscript failed = partial.failed(message);
        notify(progress, failed);
        return failed;
    }

    private static void notify(DebateProgressListener progress, DebateTranscript snapshot) {
        try {
            progress.onProgress(snapshot);
        } catch (RuntimeException ex) {
            log.error("Progress listener failed for debate {}", snapshot.debateId(), ex);
        }
    }

    private static String content(DebateTranscript transcript, DebateRound round, AgentKind kind) {
        return transcript.argument(round, kind)
                .map(Argument::content)
                .orElseThrow(() -> new IllegalStateException(
                        "Missing " + kind.wireValue() + " argument for round " + round.number()
                ));
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }

    private static RuntimeException unwrap(CompletionException ex) {
        Throwable cause = ex.getCause() == null ? ex : ex.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }

    private static final class DebateStepException extends RuntimeException {

        private final transient DebateTranscript partial;

        private DebateStepException(DebateTranscript partial, RuntimeException cause) {
            super(cause.getMessage(), cause);
            this.partial = partial;
        }

        private DebateTranscript partial() {
            return partial;
        }
    }
}
