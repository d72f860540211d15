package com.retail.billkeeper.service;

import com.retail.billkeeper.dto.CreatePartyCommand;
import com.retail.billkeeper.dto.PartyStatement;
import com.retail.billkeeper.exception.ResourceNotFoundException;
import com.retail.billkeeper.model.DocumentType;
import com.retail.billkeeper.model.Party;
import com.retail.billkeeper.repository.DocumentRepository;
import com.retail.billkeeper.repository.PartyRepository;
import com.retail.billkeeper.repository.PaymentRepository;
import com.retail.billkeeper.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class PartyService {

    private static final Logger logger = LoggerFactory.getLogger(PartyService.class);

    private final PartyRepository partyRepository;
    private final DocumentRepository documentRepository;
    private final PaymentRepository paymentRepository;
    private final AuditService auditService;

    public PartyService(PartyRepository partyRepository, DocumentRepository documentRepository,
            PaymentRepository paymentRepository, AuditService auditService) {
        this.partyRepository = partyRepository;
        this.documentRepository = documentRepository;
        this.paymentRepository = paymentRepository;
        this.auditService = auditService;
    }

    @Transactional
    public Party createParty(CreatePartyCommand command) {
        String name = command.name().trim();
        if (partyRepository.findByName(name).isPresent()) {
            throw new IllegalStateException("A party named '" + name + "' already exists");
        }
        Party party = new Party();
        party.setName(name);
        party.setContactPerson(command.contactPerson());
        party.setPhone(command.phone());
        party.setEmail(command.email());
        party.setAddress(command.address());
        party = partyRepository.save(party);
        logger.info("Created party {} ({})", party.getId(), name);
        return party;
    }

    @Transactional(readOnly = true)
    public List<Party> listActive() {
        return partyRepository.findByActiveTrueOrderByNameAsc();
    }

    /**
     * Hides the party from lists. Its documents and payments stay as they are.
     */
    @Transactional
    public void softDeleteParty(Long partyId) {
        Party party = partyRepository.findByIdForUpdate(partyId)
                .orElseThrow(() -> ResourceNotFoundException.of("Party", partyId));
        if (!party.softDelete()) {
            return;
        }
        partyRepository.save(party);
        auditService.log(AuditService.PARTY_DELETED, "Party " + party.getName() + " (id " + partyId + ")");
    }

    @Transactional(readOnly = true)
    public PartyStatement getStatement(Long partyId) {
        Party party = partyRepository.findById(partyId)
                .filter(Party::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Party", partyId));
        return new PartyStatement(
                party.getId(),
                party.getName(),
                party.getRunningBalance(),
                documentRepository.countByPartyIdAndDocumentTypeAndActiveTrueAndPaid(partyId, DocumentType.INVOICE,
                        false),
                documentRepository.countByPartyIdAndDocumentTypeAndActiveTrueAndPaid(partyId, DocumentType.INVOICE,
                        true),
                Money.round(paymentRepository.sumActiveGeneralByParty(partyId)));
    }
}
