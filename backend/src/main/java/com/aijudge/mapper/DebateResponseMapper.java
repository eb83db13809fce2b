package com.aijudge.mapper;

import com.aijudge.dto.DebateResponses;
import com.aijudge.model.Argument;
import com.aijudge.model.CaseInput;
import com.aijudge.model.CriteriaScores;
import com.aijudge.model.DebateRecord;
import com.aijudge.model.DebateRole;
import com.aijudge.model.DebateStatistics;
import com.aijudge.model.DebateStatus;
import com.aijudge.model.DebateTranscript;
import com.aijudge.model.DebateTranscriptJsonCodec;
import com.aijudge.model.Verdict;
import com.aijudge.model.Winner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class DebateResponseMapper {

    public DebateResponses.DebateDetail toDebateDetail(DebateTranscript transcript, DebateRole emotionalRole) {
        return new DebateResponses.DebateDetail(
                transcript.debateId(),
                toCaseDetail(transcript.caseInput()),
                transcript.rounds().stream()
                        .map(round -> round.stream().map(this::toArgumentDetail).toList())
                        .toList(),
                toVerdictDetail(transcript.verdict()),
                transcript.status(),
                transcript.timestamp(),
                transcript.verdictSource(),
                emotionalRole
        );
    }

    public DebateResponses.CaseDetail toCaseDetail(CaseInput caseInput) {
        return new DebateResponses.CaseDetail(
                caseInput.caseId(),
                caseInput.title(),
                caseInput.description()
        );
    }

    public DebateResponses.ArgumentDetail toArgumentDetail(Argument argument) {
        return new DebateResponses.ArgumentDetail(
                argument.lawyer(),
                argument.roundNumber(),
                argument.content(),
                argument.wordCount()
        );
    }

    public DebateResponses.VerdictDetail toVerdictDetail(Verdict verdict) {
        CriteriaScores criteria = verdict.criteriaScores();
        return new DebateResponses.VerdictDetail(
                verdict.emotionalScore(),
                verdict.logicalScore(),
                verdict.winner(),
                verdict.reasoning(),
                new DebateResponses.CriteriaScoresDetail(
                        criteria.relevance(),
                        criteria.coherence(),
                        criteria.evidence(),
                        criteria.persuasiveness(),
                        criteria.rebuttal()
                )
        );
    }

    /**
     * Winner is reported only for completed debates.
     */
    public DebateResponses.DebateSummary toDebateSummary(DebateRecord record, String caseTitle) {
        Winner winner = record.getStatus() == DebateStatus.COMPLETE
                ? DebateTranscriptJsonCodec.verdictFromJson(record.getVerdictJson()).winner()
                : null;
        return new DebateResponses.DebateSummary(
                record.getDebateId(),
                record.getCaseId(),
                caseTitle,
                record.getStatus(),
                winner,
                record.getCreatedAt()
        );
    }

    public List<DebateResponses.DebateSummary> toDebateSummaries(
            List<DebateRecord> records,
            Map<UUID, String> caseTitles
    ) {
        return records.stream()
                .map(record -> toDebateSummary(record, caseTitles.get(record.getCaseId())))
                .toList();
    }

    public DebateResponses.Statistics toStatistics(DebateStatistics statistics) {
        if (statistics == null) {
            return new DebateResponses.Statistics(0, 0, 0);
        }
        return new DebateResponses.Statistics(
                statistics.getEmotionalWins(),
                statistics.getLogicalWins(),
                statistics.getTotalDebates()
        );
    }
}
