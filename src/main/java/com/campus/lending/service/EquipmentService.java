package com.campus.lending.service;

import com.campus.lending.dto.request.CreateEquipmentRequest;
import com.campus.lending.dto.request.UpdateEquipmentRequest;
import com.campus.lending.dto.response.EquipmentResponse;
import com.campus.lending.entity.Equipment;
import com.campus.lending.exception.DuplicateSerialNumberException;
import com.campus.lending.exception.EquipmentInUseException;
import com.campus.lending.exception.ResourceNotFoundException;
import com.campus.lending.mapper.EquipmentMapper;
import com.campus.lending.repository.EquipmentRepository;
import com.campus.lending.repository.ReservationItemRepository;
import com.campus.lending.repository.ServiceTicketRepository;
import com.campus.lending.security.AccessPolicy;
import com.campus.lending.security.Actor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class EquipmentService {

    private static final Logger log = LoggerFactory.getLogger(EquipmentService.class);

    private final EquipmentRepository equipmentRepository;
    private final ReservationItemRepository reservationItemRepository;
    private final ServiceTicketRepository serviceTicketRepository;

    @Transactional(readOnly = true)
    public Page<EquipmentResponse> findAll(Pageable pageable) {
        return equipmentRepository.findAll(pageable)
            .map(EquipmentMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public EquipmentResponse findById(Long id) {
        return EquipmentMapper.toResponse(getEquipment(id));
    }

    @Transactional
    public EquipmentResponse create(Actor actor, CreateEquipmentRequest request) {
        AccessPolicy.requireStaff(actor, "add equipment");

        String serialNumber = request.serialNumber().trim();
        if (equipmentRepository.existsBySerialNumber(serialNumber)) {
            throw new DuplicateSerialNumberException(serialNumber);
        }

        Equipment saved = equipmentRepository.save(EquipmentMapper.toEntity(request));
        log.info("Equipment {} ({}) added by user {}", saved.getId(), saved.getSerialNumber(), actor.userId());
        return EquipmentMapper.toResponse(saved);
    }

    @Transactional
    public EquipmentResponse update(Actor actor, Long id, UpdateEquipmentRequest request) {
        AccessPolicy.requireStaff(actor, "edit equipment");

        Equipment equipment = getEquipment(id);

        if (request.serialNumber() != null) {
            String serialNumber = request.serialNumber().trim();
            if (!serialNumber.equals(equipment.getSerialNumber())
                    && equipmentRepository.existsBySerialNumberAndIdNot(serialNumber, id)) {
                throw new DuplicateSerialNumberException(serialNumber);
            }
        }

        EquipmentMapper.updateEntity(equipment, request);
        Equipment saved = equipmentRepository.save(equipment);
        log.info("Equipment {} updated by user {}", id, actor.userId());
        return EquipmentMapper.toResponse(saved);
    }

    /** Equipment referenced by any reservation or ticket is kept for the history. */
    @Transactional
    public void delete(Actor actor, Long id) {
        AccessPolicy.requireStaff(actor, "delete equipment");

        Equipment equipment = getEquipment(id);

        if (reservationItemRepository.existsByEquipmentId(id) || serviceTicketRepository.existsByEquipmentId(id)) {
            throw new EquipmentInUseException(id);
        }

        equipmentRepository.delete(equipment);
        log.info("Equipment {} deleted by user {}", id, actor.userId());
    }

    private Equipment getEquipment(Long id) {
        return equipmentRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Equipment", id));
    }
}
