package com.aijudge.service;

import com.aijudge.dto.DebateRequests;
import com.aijudge.dto.DebateResponses;
import com.aijudge.mapper.DebateResponseMapper;
import com.aijudge.model.DebateCase;
import com.aijudge.model.DebateRecord;
import com.aijudge.model.DebateRole;
import com.aijudge.model.DebateStatistics;
import com.aijudge.model.DebateStatus;
import com.aijudge.model.DebateTranscript;
import com.aijudge.model.DebateTranscriptJsonCodec;
import com.aijudge.model.Verdict;
import com.aijudge.repository.DebateCaseRepository;
import com.aijudge.repository.DebateRecordRepository;
import com.aijudge.repository.DebateStatisticsRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class DebateService {

    private static final Logger log = LoggerFactory.getLogger(DebateService.class);

    private final DebateCaseRepository debateCaseRepository;
    private final DebateRecordRepository debateRecordRepository;
    private final DebateStatisticsRepository debateStatisticsRepository;
    private final DebatePersistenceService debatePersistenceService;
    private final DebateRunQueuePublisher debateRunQueuePublisher;
    private final DebateResponseMapper debateResponseMapper;

    @Transactional
    public DebateResponses.CaseCreated createCase(DebateRequests.CreateCaseRequest request) {
        OffsetDateTime now = OffsetDateTime.now();
        DebateCase debateCase = new DebateCase();
        debateCase.setCaseId(UUID.randomUUID());
        debateCase.setTitle(request.title().trim());
        debateCase.setDescription(request.description().trim());
        debateCase.setCreatedAt(now);
        debateCase.setUpdatedAt(now);

        DebateCase saved = debateCaseRepository.save(debateCase);
        log.info("Created case {}", saved.getCaseId());
        return new DebateResponses.CaseCreated(saved.getCaseId());
    }

    @Transactional
    public DebateResponses.DebateStarted startDebate(UUID caseId, DebateRequests.StartDebateRequest request) {
        DebateCase debateCase = debateCaseRepository.findById(caseId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Case not found: " + caseId
                ));
        DebateRole emotionalRole = request == null || request.emotionalRole() == null
                ? DebateRole.PROSECUTION
                : request.emotionalRole();

        OffsetDateTime now = OffsetDateTime.now();
        DebateTranscript initial = DebateTranscript.start(UUID.randomUUID(), debateCase.toCaseInput(), now);

        DebateRecord record = new DebateRecord();
        record.setDebateId(initial.debateId());
        record.setCaseId(debateCase.getCaseId());
        record.setStatus(DebateStatus.IN_PROGRESS);
        record.setEmotionalRole(emotionalRole);
        record.setRoundsJson(DebateTranscriptJsonCodec.roundsToJson(initial.rounds()));
        record.setVerdictJson(DebateTranscriptJsonCodec.verdictToJson(Verdict.placeholder()));
        record.setStartedAt(now);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);

        DebateRecord saved = debateRecordRepository.save(record);
        debateRunQueuePublisher.publishDebateReady(saved.getDebateId());
        log.info("Queued debate {} for case {}", saved.getDebateId(), caseId);
        return new DebateResponses.DebateStarted(saved.getDebateId(), saved.getStatus());
    }

    @Transactional(readOnly = true)
    public DebateResponses.DebateDetail getDebate(UUID debateId) {
        DebateRecord record = debateRecordRepository.findById(debateId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Debate not found: " + debateId
                ));
        DebateCase debateCase = debateCaseRepository.findById(record.getCaseId())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "Case not found for debate: " + debateId
                ));
        DebateTranscript transcript = debatePersistenceService.toTranscript(record, debateCase);
        return debateResponseMapper.toDebateDetail(transcript, record.getEmotionalRole());
    }

    @Transactional(readOnly = true)
    public List<DebateResponses.DebateSummary> listDebates() {
        List<DebateRecord> records = debateRecordRepository.findAllByOrderByCreatedAtDesc();
        List<UUID> caseIds = records.stream().map(DebateRecord::getCaseId).distinct().toList();
        Map<UUID, String> caseTitles = debateCaseRepository.findAllById(caseIds).stream()
                .collect(Collectors.toMap(DebateCase::getCaseId, DebateCase::getTitle));
        return debateResponseMapper.toDebateSummaries(records, caseTitles);
    }

    @Transactional(readOnly = true)
    public DebateResponses.Statistics getStatistics() {
        DebateStatistics statistics = debateStatisticsRepository.findById(DebateStatistics.SINGLETON_ID).orElse(null);
        return debateResponseMapper.toStatistics(statistics);
    }
}
