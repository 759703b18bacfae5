package com.lifelink.backend.modules.request.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.donation.application.DonationService;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.OrganType;
import com.lifelink.backend.modules.request.domain.RequestKind;
import com.lifelink.backend.modules.request.domain.RequestStatus;
import com.lifelink.backend.modules.request.domain.Urgency;
import com.lifelink.backend.modules.request.infrastructure.persistence.DonationRequestRepository;
import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.modules.user.infrastructure.persistence.HospitalRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class DonationRequestService {

    private static final Logger log = LoggerFactory.getLogger(DonationRequestService.class);

    private final DonationRequestRepository requestRepository;
    private final HospitalRepository hospitalRepository;
    private final DonationService donationService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public DonationRequestService(
            DonationRequestRepository requestRepository,
            HospitalRepository hospitalRepository,
            DonationService donationService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.requestRepository = requestRepository;
        this.hospitalRepository = hospitalRepository;
        this.donationService = donationService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public DonationRequest createRequest(UUID hospitalId, CreateRequestCommand command) {
        Hospital hospital = hospitalRepository.findById(hospitalId)
                .orElseThrow(() -> ProblemException.notFound("HOSPITAL_NOT_FOUND"));

        RequestKind kind = RequestKind.fromCode(command.kind())
                .orElseThrow(() -> ProblemException.badRequest("INVALID_KIND", "Kind must be blood or organ"));
        Urgency urgency = command.urgency() == null
                ? Urgency.MEDIUM
                : Urgency.fromCode(command.urgency())
                        .orElseThrow(() -> ProblemException.badRequest("INVALID_URGENCY", "Urgency must be low, medium, high or critical"));

        int quantity = command.quantity() == null ? 1 : command.quantity();
        if (quantity < 1) {
            throw ProblemException.badRequest("INVALID_QUANTITY", "Quantity must be at least 1");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.requiredBy() == null || !command.requiredBy().isAfter(now)) {
            throw ProblemException.badRequest("REQUIRED_BY_NOT_IN_FUTURE", "Required-by date must be in the future");
        }

        DonationRequest request = switch (kind) {
            case BLOOD -> {
                if (hasText(command.organType())) {
                    throw ProblemException.badRequest("SUBTYPE_MISMATCH", "Blood requests must not carry an organ type");
                }
                if (!hasText(command.bloodType())) {
                    throw ProblemException.badRequest("BLOOD_TYPE_REQUIRED", "Blood type is required for blood requests");
                }
                BloodType bloodType = BloodType.fromCode(command.bloodType())
                        .orElseThrow(() -> ProblemException.badRequest("INVALID_BLOOD_TYPE", "Unknown blood type: " + command.bloodType()));
                yield DonationRequest.blood(hospital, bloodType, urgency, command.requiredBy(), quantity);
            }
            case ORGAN -> {
                if (hasText(command.bloodType())) {
                    throw ProblemException.badRequest("SUBTYPE_MISMATCH", "Organ requests must not carry a blood type");
                }
                if (!hasText(command.organType())) {
                    throw ProblemException.badRequest("ORGAN_TYPE_REQUIRED", "Organ type is required for organ requests");
                }
                OrganType organType = OrganType.fromCode(command.organType())
                        .orElseThrow(() -> ProblemException.badRequest("INVALID_ORGAN_TYPE", "Unknown organ type: " + command.organType()));
                yield DonationRequest.organ(hospital, organType, urgency, command.requiredBy(), quantity);
            }
        };
        request.setNotes(command.notes());

        DonationRequest saved = requestRepository.save(request);
        log.info("Request created requestId={} hospitalId={} kind={} urgency={}", saved.getId(), hospitalId, kind, urgency);
        eventPublisher.publishEvent(new RequestPublishedEvent(saved.getId()));
        return saved;
    }

    public DonationRequest updateStatus(UUID hospitalId, UUID requestId, String status) {
        RequestStatus target = RequestStatus.fromCode(status)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_STATUS", "Invalid request status: " + status));
        DonationRequest request = loadOwnedRequest(hospitalId, requestId);
        return applyStatus(request, target);
    }

    public DonationRequest cancelRequest(UUID hospitalId, UUID requestId) {
        DonationRequest request = loadOwnedRequest(hospitalId, requestId);
        return applyStatus(request, RequestStatus.CANCELLED);
    }

    @Transactional(readOnly = true)
    public DonationRequest getOwnedRequest(UUID hospitalId, UUID requestId) {
        return loadOwnedRequest(hospitalId, requestId);
    }

    @Transactional(readOnly = true)
    public DonationRequest getRequest(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("REQUEST_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Page<DonationRequest> getHospitalRequests(UUID hospitalId, RequestStatus status, RequestKind kind, Pageable pageable) {
        return requestRepository.searchByHospital(hospitalId, status, kind, pageable);
    }

    @Transactional(readOnly = true)
    public Page<DonationRequest> getOpenRequests(RequestKind kind, Urgency urgency, Pageable pageable) {
        return requestRepository.searchOpen(RequestStatus.OPEN, kind, urgency, pageable);
    }

    private DonationRequest applyStatus(DonationRequest request, RequestStatus target) {
        RequestStatus previous = request.getStatus();
        request.setStatus(target);
        if (target == RequestStatus.CANCELLED && previous != RequestStatus.CANCELLED) {
            int cancelled = donationService.cancelOpenDonationsForRequest(request.getId());
            log.info("Request cancelled requestId={} cascadedDonations={}", request.getId(), cancelled);
        } else {
            log.info("Request status changed requestId={} from={} to={}", request.getId(), previous, target);
        }
        return request;
    }

    private DonationRequest loadOwnedRequest(UUID hospitalId, UUID requestId) {
        DonationRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("REQUEST_NOT_FOUND"));
        if (!request.getHospital().getId().equals(hospitalId)) {
            throw ProblemException.forbidden("REQUEST_ACCESS_DENIED");
        }
        return request;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public record CreateRequestCommand(
            String kind,
            String bloodType,
            String organType,
            String urgency,
            OffsetDateTime requiredBy,
            Integer quantity,
            String notes
    ) {
    }
}
