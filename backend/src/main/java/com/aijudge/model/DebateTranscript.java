package com.aijudge.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable snapshot of a debate. Every state change produces a new snapshot.
 */
public record DebateTranscript(
        UUID debateId,
        CaseInput caseInput,
        List<List<Argument>> rounds,
        Verdict verdict,
        DebateStatus status,
        OffsetDateTime timestamp,
        VerdictSource verdictSource
) {
    static final String FAILURE_REASONING_PREFIX = "Debate generation failed: ";

    private static final int ROUND_COUNT = DebateRound.orderedValues().size();
    private static final Comparator<Argument> ARGUMENT_ORDER = Comparator.comparing(Argument::lawyer);

    public DebateTranscript {
        Objects.requireNonNull(debateId, "debateId is required");
        Objects.requireNonNull(caseInput, "caseInput is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        verdict = verdict == null ? Verdict.placeholder() : verdict;
        rounds = normalizeRounds(rounds);
    }

    public static DebateTranscript start(UUID debateId, CaseInput caseInput, OffsetDateTime timestamp) {
        return new DebateTranscript(
                debateId,
                caseInput,
                List.of(),
                Verdict.placeholder(),
                DebateStatus.IN_PROGRESS,
                timestamp,
                null
        );
    }

    public List<Argument> round(DebateRound round) {
        return rounds.get(round.number() - 1);
    }

    public Optional<Argument> argument(DebateRound round, AgentKind lawyer) {
        return round(round).stream()
                .filter(argument -> argument.lawyer() == lawyer)
                .findFirst();
    }

    /**
     * All arguments in judging order: round by round, emotional before logical.
     */
    public List<Argument> arguments() {
        List<Argument> flattened = new ArrayList<>();
        for (List<Argument> round : rounds) {
            flattened.addAll(round);
        }
        return List.copyOf(flattened);
    }

    public boolean isComplete() {
        return status == DebateStatus.COMPLETE;
    }

    public DebateTranscript withRound(DebateRound round, List<Argument> arguments) {
        List<List<Argument>> nextRounds = new ArrayList<>(rounds);
        nextRounds.set(round.number() - 1, arguments == null ? List.of() : arguments);
        return new DebateTranscript(debateId, caseInput, nextRounds, verdict, status, timestamp, verdictSource);
    }

    public DebateTranscript completed(Verdict finalVerdict, VerdictSource source) {
        Objects.requireNonNull(finalVerdict, "finalVerdict is required");
        return new DebateTranscript(
                debateId,
                caseInput,
                rounds,
                finalVerdict,
                DebateStatus.COMPLETE,
                timestamp,
                source
        );
    }

    /**
     * Failed snapshot: rounds are kept, the verdict stays a placeholder carrying the failure message.
     */
    public DebateTranscript failed(String message) {
        String detail = message == null || message.isBlank() ? "unknown error" : message.trim();
        return new DebateTranscript(
                debateId,
                caseInput,
                rounds,
                Verdict.placeholder().withReasoning(FAILURE_REASONING_PREFIX + detail),
                DebateStatus.FAILED,
                timestamp,
                null
        );
    }

    private static List<List<Argument>> normalizeRounds(List<List<Argument>> rounds) {
        List<List<Argument>> source = rounds == null ? List.of() : rounds;
        if (source.size() > ROUND_COUNT) {
            throw new IllegalArgumentException("A debate has at most " + ROUND_COUNT + " rounds");
        }
        List<List<Argument>> normalized = new ArrayList<>(ROUND_COUNT);
        for (int index = 0; index < ROUND_COUNT; index++) {
            List<Argument> round = index < source.size() && source.get(index) != null
                    ? source.get(index)
                    : List.of();
            normalized.add(normalizeRound(index + 1, round));
        }
        return List.copyOf(normalized);
    }

    private static List<Argument> normalizeRound(int roundNumber, List<Argument> round) {
        if (round.size() > AgentKind.values().length) {
            throw new IllegalArgumentException("Round " + roundNumber + " holds at most one argument per lawyer");
        }
        Set<AgentKind> seen = EnumSet.noneOf(AgentKind.class);
        for (Argument argument : round) {
            Objects.requireNonNull(argument, "argument is required");
            if (argument.roundNumber() != roundNumber) {
                throw new IllegalArgumentException(
                        "Argument for round " + argument.roundNumber() + " cannot be placed in round " + roundNumber
                );
            }
            if (!seen.add(argument.lawyer())) {
                throw new IllegalArgumentException(
                        "Round " + roundNumber + " already has an argument from " + argument.lawyer().wireValue()
                );
            }
        }
        return round.stream().sorted(ARGUMENT_ORDER).toList();
    }
}
