package com.anthem.rxadj.pa;

import com.anthem.rxadj.config.RxAdjudicationProperties;
import com.anthem.rxadj.criteria.ClinicalCriteriaEvaluator;
import com.anthem.rxadj.criteria.ClinicalCriteriaSet;
import com.anthem.rxadj.criteria.CriteriaEvaluationResult;
import com.anthem.rxadj.drug.DrugIdentifier;
import com.anthem.rxadj.exception.IllegalDeterminationException;
import com.anthem.rxadj.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Stream;

/**
 * Prior Authorization Workflow.
 *
 * <p>Requests start PENDING and receive exactly one determination: APPROVED, PARTIAL or DENIED.
 * Records are held in memory; a determination is applied atomically so two reviewers racing on
 * the same request cannot both succeed. Determined records are evicted once they can no longer
 * matter: approvals after their expiration date, denials after their appeal deadline. PENDING
 * records are kept until determined.
 */
@Service
public class PriorAuthWorkflow {

    private static final Logger log = LoggerFactory.getLogger(PriorAuthWorkflow.class);

    private static final DateTimeFormatter REQUEST_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String AUTO_REVIEWER = "AUTO";
    private static final String CRITERIA_REVIEWER = "CRITERIA";

    private final Map<String, PriorAuthRecord> records = new ConcurrentHashMap<>();
    private final ClinicalCriteriaEvaluator criteriaEvaluator;
    private final RxAdjudicationProperties.PriorAuth config;
    private final Clock clock;

    public PriorAuthWorkflow(ClinicalCriteriaEvaluator criteriaEvaluator,
                             RxAdjudicationProperties properties,
                             Clock clock) {
        this.criteriaEvaluator = criteriaEvaluator;
        this.config = properties.getPriorAuth();
        this.clock = clock;
    }

    /**
     * Register a new PENDING request.
     */
    public PriorAuthRequest createRequest(PriorAuthSubmission submission) {
        validateSubmission(submission);
        LocalDateTime now = LocalDateTime.now(clock);

        while (true) {
            PriorAuthRequest request = PriorAuthRequest.builder()
                    .paRequestId(generateRequestId(now.toLocalDate()))
                    .memberId(submission.getMemberId())
                    .cardholderId(submission.getCardholderId())
                    .drug(submission.getDrug())
                    .quantityRequested(submission.getQuantityRequested())
                    .daysSupplyRequested(submission.getDaysSupplyRequested())
                    .prescriberNpi(submission.getPrescriberNpi())
                    .prescriberName(submission.getPrescriberName())
                    .prescriberSpecialty(submission.getPrescriberSpecialty())
                    .diagnosisCodes(submission.getDiagnosisCodes())
                    .previousTherapies(submission.getPreviousTherapies())
                    .labResults(submission.getLabResults())
                    .memberAge(submission.getMemberAge())
                    .urgency(submission.getUrgency())
                    .requestType(submission.getRequestType())
                    .requestDate(now)
                    .build();

            PriorAuthRecord record = PriorAuthRecord.builder()
                    .request(request)
                    .statusChange(new StatusChange(PriorAuthStatus.PENDING, now, "Request created"))
                    .build();

            if (records.putIfAbsent(request.getPaRequestId(), record) == null) {
                log.info("PA request created: paRequestId={}, member={}, drug={}, urgency={}, type={}",
                        request.getPaRequestId(), request.getMemberId(), request.getDrug().displayName(),
                        request.getUrgency(), request.getRequestType());
                return request;
            }
        }
    }

    /**
     * Emergency requests and renewals are approved without review.
     *
     * @return the approval, or empty when the request needs review
     */
    public Optional<PriorAuthResponse> checkAutoApproval(PriorAuthRequest request) {
        if (request.getUrgency() == Urgency.EMERGENCY) {
            return Optional.of(determine(request.getPaRequestId(), approval(request,
                    ApprovalTerms.builder().durationDays(config.getEmergencyDurationDays()).build(),
                    true, null)));
        }
        if (request.getRequestType() == PriorAuthRequestType.RENEWAL) {
            return Optional.of(determine(request.getPaRequestId(),
                    approval(request, ApprovalTerms.builder().build(), true, null)));
        }
        return Optional.empty();
    }

    public Optional<PriorAuthResponse> checkExistingAuth(String memberId, DrugIdentifier drug) {
        return checkExistingAuth(memberId, drug, LocalDate.now(clock));
    }

    /**
     * Most recent approval for the member and NDC whose effective window contains {@code asOf}.
     */
    public Optional<PriorAuthResponse> checkExistingAuth(String memberId, DrugIdentifier drug, LocalDate asOf) {
        if (memberId == null || drug == null || !drug.hasNdc()) {
            return Optional.empty();
        }
        return activeAuthorizations(memberId, drug, asOf)
                .max(Comparator.comparing(PriorAuthResponse::getEffectiveDate)
                        .thenComparing(PriorAuthResponse::getResponseDate));
    }

    /**
     * Active approval carrying the given authorization number for the member and NDC.
     *
     * @return the approval, or empty when the number is unknown, belongs to another member or drug,
     *         or does not cover {@code asOf}
     */
    public Optional<PriorAuthResponse> findAuthorization(String authorizationNumber, String memberId,
                                                         DrugIdentifier drug, LocalDate asOf) {
        if (authorizationNumber == null || authorizationNumber.isBlank()
                || memberId == null || drug == null || !drug.hasNdc()) {
            return Optional.empty();
        }
        String number = authorizationNumber.trim();
        return activeAuthorizations(memberId, drug, asOf)
                .filter(response -> number.equals(response.getAuthorizationNumber()))
                .findFirst();
    }

    private Stream<PriorAuthResponse> activeAuthorizations(String memberId, DrugIdentifier drug, LocalDate asOf) {
        return records.values().stream()
                .filter(r -> memberId.equals(r.getRequest().getMemberId()))
                .filter(r -> drug.getNdc().equals(r.getRequest().getDrug().getNdc()))
                .map(PriorAuthRecord::getResponse)
                .filter(response -> response != null && response.isActiveOn(asOf));
    }

    public PriorAuthResponse approve(PriorAuthRequest request) {
        return approve(request, ApprovalTerms.builder().build());
    }

    public PriorAuthResponse approve(PriorAuthRequest request, ApprovalTerms terms) {
        return determine(request.getPaRequestId(), approval(request, terms, false, null));
    }

    /**
     * Approve with reduced terms.
     *
     * @throws InvalidRequestException when the approved quantity or days supply exceeds the request
     */
    public PriorAuthResponse partialApprove(PriorAuthRequest request, BigDecimal quantity, int daysSupply,
                                            Integer durationDays, String reason, String reviewedBy) {
        if (quantity == null || quantity.signum() < 0 || quantity.compareTo(request.getQuantityRequested()) > 0) {
            throw new InvalidRequestException("quantityApproved",
                    "Partial approval quantity must be between 0 and the requested " + request.getQuantityRequested());
        }
        if (daysSupply < 0 || daysSupply > request.getDaysSupplyRequested()) {
            throw new InvalidRequestException("daysSupplyApproved",
                    "Partial approval days supply must be between 0 and the requested " + request.getDaysSupplyRequested());
        }

        LocalDate today = LocalDate.now(clock);
        int duration = durationDays != null ? durationDays : config.getPartialDurationDays();
        PriorAuthResponse response = PriorAuthResponse.builder()
                .paRequestId(request.getPaRequestId())
                .status(PriorAuthStatus.PARTIAL)
                .responseDate(LocalDateTime.now(clock))
                .authorizationNumber(generateAuthorizationNumber())
                .effectiveDate(today)
                .expirationDate(today.plusDays(duration))
                .quantityApproved(quantity)
                .daysSupplyApproved(daysSupply)
                .refillsApproved(config.getPartialRefills())
                .denialMessage(reason != null ? reason : "Approved with modifications")
                .reviewedBy(reviewedBy)
                .build();
        return determine(request.getPaRequestId(), response);
    }

    /**
     * Deny the request. The appeal deadline is the denial date plus the configured appeal window.
     */
    public PriorAuthResponse deny(PriorAuthRequest request, PriorAuthDenialReason reason, String message,
                                  List<String> alternatives) {
        return deny(request, reason, message, alternatives, null, null);
    }

    public PriorAuthResponse deny(PriorAuthRequest request, PriorAuthDenialReason reason, String message,
                                  List<String> alternatives, String reviewedBy) {
        return deny(request, reason, message, alternatives, reviewedBy, null);
    }

    /**
     * Evaluate the request against the criteria set governing its drug. Met criteria approve the
     * request, unmet criteria deny it. Without a configured set the request stays PENDING for
     * manual review and the returned response carries PENDING.
     */
    public PriorAuthResponse reviewAgainstCriteria(PriorAuthRequest request) {
        requireRecord(request.getPaRequestId());
        Optional<ClinicalCriteriaSet> criteriaSet = criteriaEvaluator.findCriteriaSet(request.getDrug());
        if (criteriaSet.isEmpty()) {
            log.info("No criteria set for drug {}, PA {} left for manual review",
                    request.getDrug().displayName(), request.getPaRequestId());
            return PriorAuthResponse.builder()
                    .paRequestId(request.getPaRequestId())
                    .status(PriorAuthStatus.PENDING)
                    .responseDate(LocalDateTime.now(clock))
                    .denialMessage("No clinical criteria configured; manual review required")
                    .build();
        }

        CriteriaEvaluationResult result = criteriaEvaluator.evaluate(criteriaSet.get(), request.toClinicalContext(),
                request.getQuantityRequested(), request.getDaysSupplyRequested());

        if (result.isMet()) {
            return determine(request.getPaRequestId(),
                    approval(request, ApprovalTerms.builder().reviewedBy(CRITERIA_REVIEWER).build(), false, result));
        }
        String message = "Criteria not met: " + String.join("; ", result.getUnmetDescriptions());
        return deny(request, PriorAuthDenialReason.CRITERIA_NOT_MET, message, List.of(), CRITERIA_REVIEWER, result);
    }

    public Optional<PriorAuthRecord> getRecord(String paRequestId) {
        return Optional.ofNullable(records.get(paRequestId));
    }

    @Scheduled(fixedDelayString = "${rxadj.prior-auth.purge-interval-ms:3600000}")
    public void purgeExpiredRecords() {
        purgeExpired(LocalDate.now(clock));
    }

    /**
     * Remove determined records whose authorization expired or whose appeal deadline passed before {@code asOf}.
     *
     * @return number of records removed
     */
    public int purgeExpired(LocalDate asOf) {
        int removed = 0;
        for (Map.Entry<String, PriorAuthRecord> entry : records.entrySet()) {
            // a record replaced since the read is left for the next sweep
            if (isExpired(entry.getValue(), asOf) && records.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged expired PA records: removed={}, remaining={}, asOf={}", removed, records.size(), asOf);
        }
        return removed;
    }

    private static boolean isExpired(PriorAuthRecord record, LocalDate asOf) {
        PriorAuthResponse response = record.getResponse();
        if (response == null || !response.getStatus().isTerminal()) {
            return false;
        }
        LocalDate keepUntil = response.getStatus() == PriorAuthStatus.DENIED
                ? response.getAppealDeadline()
                : response.getExpirationDate();
        return keepUntil != null && keepUntil.isBefore(asOf);
    }

    private PriorAuthResponse deny(PriorAuthRequest request, PriorAuthDenialReason reason, String message,
                                   List<String> alternatives, String reviewedBy, CriteriaEvaluationResult criteriaResult) {
        if (reason == null) {
            throw new InvalidRequestException("denialReason", "Denial reason is required");
        }
        LocalDate today = LocalDate.now(clock);
        PriorAuthResponse response = PriorAuthResponse.builder()
                .paRequestId(request.getPaRequestId())
                .status(PriorAuthStatus.DENIED)
                .responseDate(LocalDateTime.now(clock))
                .denialReason(reason)
                .denialMessage(message != null ? message : "Denied: " + reason.getDescription())
                .suggestedAlternatives(alternatives == null ? List.of() : List.copyOf(alternatives))
                .appealDeadline(today.plusDays(config.getAppealWindowDays()))
                .appealInstructions(config.getAppealInstructions())
                .reviewedBy(reviewedBy)
                .criteriaResult(criteriaResult)
                .build();
        return determine(request.getPaRequestId(), response);
    }

    private PriorAuthResponse approval(PriorAuthRequest request, ApprovalTerms terms, boolean auto,
                                       CriteriaEvaluationResult criteriaResult) {
        LocalDate today = LocalDate.now(clock);
        int duration = terms.getDurationDays() != null ? terms.getDurationDays() : config.getApprovalDurationDays();
        String reviewer = terms.getReviewedBy() != null ? terms.getReviewedBy() : (auto ? AUTO_REVIEWER : null);
        return PriorAuthResponse.builder()
                .paRequestId(request.getPaRequestId())
                .status(PriorAuthStatus.APPROVED)
                .responseDate(LocalDateTime.now(clock))
                .authorizationNumber(generateAuthorizationNumber())
                .effectiveDate(today)
                .expirationDate(today.plusDays(duration))
                .quantityApproved(terms.getQuantity() != null ? terms.getQuantity() : request.getQuantityRequested())
                .daysSupplyApproved(terms.getDaysSupply() != null ? terms.getDaysSupply() : request.getDaysSupplyRequested())
                .refillsApproved(terms.getRefills() != null ? terms.getRefills() : config.getDefaultRefills())
                .reviewedBy(reviewer)
                .autoApproved(auto)
                .criteriaResult(criteriaResult)
                .build();
    }

    /**
     * Attach the determination to a PENDING record.
     *
     * @throws IllegalDeterminationException when the request is unknown or already determined
     */
    private PriorAuthResponse determine(String paRequestId, PriorAuthResponse response) {
        records.compute(paRequestId, (id, record) -> {
            if (record == null) {
                throw new IllegalDeterminationException(id, "Unknown prior authorization request: " + id);
            }
            if (record.getStatus().isTerminal()) {
                throw new IllegalDeterminationException(id,
                        "Prior authorization " + id + " is already " + record.getStatus());
            }
            return record.toBuilder()
                    .response(response)
                    .statusChange(new StatusChange(response.getStatus(), response.getResponseDate(),
                            "Status changed to " + response.getStatus()))
                    .build();
        });

        log.info("PA determination: paRequestId={}, status={}, authNumber={}, autoApproved={}",
                paRequestId, response.getStatus(), response.getAuthorizationNumber(), response.isAutoApproved());
        return response;
    }

    private PriorAuthRecord requireRecord(String paRequestId) {
        PriorAuthRecord record = records.get(paRequestId);
        if (record == null) {
            throw new IllegalDeterminationException(paRequestId, "Unknown prior authorization request: " + paRequestId);
        }
        return record;
    }

    private void validateSubmission(PriorAuthSubmission submission) {
        if (submission.getMemberId() == null || submission.getMemberId().isBlank()) {
            throw new InvalidRequestException("memberId", "Member id is required");
        }
        if (submission.getDrug() == null) {
            throw new InvalidRequestException("drug", "Drug is required");
        }
        if (submission.getQuantityRequested() == null || submission.getQuantityRequested().signum() < 0) {
            throw new InvalidRequestException("quantityRequested", "Requested quantity must be zero or greater");
        }
        if (submission.getDaysSupplyRequested() < 0) {
            throw new InvalidRequestException("daysSupplyRequested", "Requested days supply must be zero or greater");
        }
    }

    private String generateRequestId(LocalDate date) {
        return String.format("PA-%s-%06d", date.format(REQUEST_DATE_FORMAT),
                ThreadLocalRandom.current().nextInt(1_000_000));
    }

    private String generateAuthorizationNumber() {
        return String.format("AUTH%09d", ThreadLocalRandom.current().nextInt(1_000_000_000));
    }
}
