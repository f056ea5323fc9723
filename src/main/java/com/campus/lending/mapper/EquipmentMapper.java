package com.campus.lending.mapper;

import com.campus.lending.dto.request.CreateEquipmentRequest;
import com.campus.lending.dto.request.UpdateEquipmentRequest;
import com.campus.lending.dto.response.EquipmentResponse;
import com.campus.lending.entity.Equipment;

public final class EquipmentMapper {

    private EquipmentMapper() {}

    public static Equipment toEntity(CreateEquipmentRequest request) {
        Equipment equipment = new Equipment();
        equipment.setName(request.name().trim());
        equipment.setCategory(request.category().trim());
        equipment.setSerialNumber(request.serialNumber().trim());
        equipment.setCondition(conditionOrDefault(request.condition()));
        equipment.setLocation(request.location().trim());
        equipment.setDailyLimit(request.dailyLimit() != null ? request.dailyLimit() : 1);
        return equipment;
    }

    public static EquipmentResponse toResponse(Equipment equipment) {
        return new EquipmentResponse(
            equipment.getId(),
            equipment.getName(),
            equipment.getCategory(),
            equipment.getSerialNumber(),
            equipment.getCondition(),
            equipment.getLocation(),
            equipment.effectiveDailyLimit(),
            equipment.getCreatedAt(),
            equipment.getUpdatedAt()
        );
    }

    public static void updateEntity(Equipment equipment, UpdateEquipmentRequest request) {
        if (request.name() != null) {
            equipment.setName(request.name().trim());
        }
        if (request.category() != null) {
            equipment.setCategory(request.category().trim());
        }
        if (request.serialNumber() != null) {
            equipment.setSerialNumber(request.serialNumber().trim());
        }
        if (request.condition() != null) {
            equipment.setCondition(conditionOrDefault(request.condition()));
        }
        if (request.location() != null) {
            equipment.setLocation(request.location().trim());
        }
        if (request.dailyLimit() != null) {
            equipment.setDailyLimit(request.dailyLimit());
        }
    }

    private static String conditionOrDefault(String condition) {
        return condition == null || condition.isBlank() ? Equipment.DEFAULT_CONDITION : condition.trim();
    }
}
