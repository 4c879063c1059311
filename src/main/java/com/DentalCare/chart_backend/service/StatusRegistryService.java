package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.dto.request.CustomStatusRequest;
import com.DentalCare.chart_backend.dto.request.CustomStatusUpdateRequest;
import com.DentalCare.chart_backend.dto.response.StatusDescriptor;
import com.DentalCare.chart_backend.dto.response.StatusGroup;
import com.DentalCare.chart_backend.enums.BuiltInStatus;
import com.DentalCare.chart_backend.enums.StatusCategory;
import com.DentalCare.chart_backend.exception.ApiException;
import com.DentalCare.chart_backend.exception.DuplicateStatusException;
import com.DentalCare.chart_backend.exception.ResourceNotFoundException;
import com.DentalCare.chart_backend.exception.UnknownStatusException;
import com.DentalCare.chart_backend.exception.ValidationException;
import com.DentalCare.chart_backend.model.CustomStatus;
import com.DentalCare.chart_backend.repository.CustomStatusRepository;
import com.DentalCare.chart_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Built-in status catalog plus clinic-defined custom statuses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusRegistryService {

    private static final Pattern CODE_PATTERN = Pattern.compile(Constants.STATUS_CODE_PATTERN);
    private static final Pattern COLOR_PATTERN = Pattern.compile(Constants.COLOR_PATTERN);

    private final CustomStatusRepository customStatusRepository;

    /**
     * Resolves a code that may be used for new entries.
     *
     * @throws UnknownStatusException if the code is neither built-in nor an active custom status
     */
    @Transactional(readOnly = true)
    public StatusDescriptor resolve(String code) {
        String normalized = normalize(code);
        Optional<BuiltInStatus> builtIn = BuiltInStatus.fromCode(normalized);
        if (builtIn.isPresent()) {
            return toDescriptor(builtIn.get());
        }
        return customStatusRepository.findByCodeIgnoreCase(normalized)
                .filter(CustomStatus::isActive)
                .map(this::toDescriptor)
                .orElseThrow(() -> new UnknownStatusException(code));
    }

    /**
     * Lenient lookup for rendering stored codes. Deactivated custom statuses
     * still resolve; unknown codes get the fallback colour.
     */
    @Transactional(readOnly = true)
    public StatusDescriptor describe(String code) {
        String normalized = normalize(code);
        Optional<BuiltInStatus> builtIn = BuiltInStatus.fromCode(normalized);
        if (builtIn.isPresent()) {
            return toDescriptor(builtIn.get());
        }
        return customStatusRepository.findByCodeIgnoreCase(normalized)
                .map(this::toDescriptor)
                .orElseGet(() -> StatusDescriptor.builder()
                        .code(normalized)
                        .displayName(normalized)
                        .color(Constants.FALLBACK_STATUS_COLOR)
                        .category(StatusCategory.OTHER)
                        .builtIn(false)
                        .active(false)
                        .build());
    }

    /**
     * Parses a status list at the write boundary: trims, lower-cases, drops
     * duplicates keeping first occurrence, and resolves every code.
     */
    @Transactional(readOnly = true)
    public List<String> validateCodes(Collection<String> codes) {
        if (codes == null || codes.isEmpty()) {
            throw ValidationException.forField("statuses", "statuses", "At least one status is required");
        }
        Set<String> ordered = new LinkedHashSet<>();
        for (String code : codes) {
            if (code == null || code.isBlank()) {
                throw ValidationException.forField("statuses", "statuses", "Status codes must not be blank");
            }
            ordered.add(resolve(code).getCode());
        }
        return new ArrayList<>(ordered);
    }

    public boolean isKnown(String code) {
        String normalized = normalize(code);
        return BuiltInStatus.isBuiltIn(normalized) || customStatusRepository.existsByCodeIgnoreCase(normalized);
    }

    @Transactional
    public StatusDescriptor registerCustom(CustomStatusRequest request) {
        String code = normalize(request.getCode());
        if (!CODE_PATTERN.matcher(code).matches()) {
            throw ValidationException.forField("customStatus", "code",
                    "Status code must start with a letter and contain only lower-case letters, digits and underscores");
        }
        if (BuiltInStatus.isBuiltIn(code)) {
            throw new DuplicateStatusException(code, true);
        }
        if (customStatusRepository.existsByCodeIgnoreCase(code)) {
            throw new DuplicateStatusException(code, false);
        }
        if (request.getDisplayName() == null || request.getDisplayName().isBlank()) {
            throw ValidationException.forField("customStatus", "displayName", "Display name is required");
        }

        CustomStatus customStatus = CustomStatus.builder()
                .code(code)
                .displayName(request.getDisplayName().trim())
                .color(validateColor(request.getColor()))
                .category(request.getCategory() != null ? request.getCategory() : StatusCategory.OTHER)
                .active(true)
                .build();

        CustomStatus saved = customStatusRepository.save(customStatus);
        log.info("Custom status registered: {} ({})", saved.getCode(), saved.getDisplayName());

        return toDescriptor(saved);
    }

    @Transactional
    public StatusDescriptor update(String code, CustomStatusUpdateRequest request) {
        CustomStatus customStatus = findCustom(code);

        if (request.getDisplayName() != null && !request.getDisplayName().isBlank()) {
            customStatus.setDisplayName(request.getDisplayName().trim());
        }
        if (request.getColor() != null) {
            customStatus.setColor(validateColor(request.getColor()));
        }
        if (request.getCategory() != null) {
            customStatus.setCategory(request.getCategory());
        }

        CustomStatus saved = customStatusRepository.save(customStatus);
        log.info("Custom status updated: {}", saved.getCode());
        return toDescriptor(saved);
    }

    /**
     * Hides a custom status from selection. Entries that already store the code keep it.
     */
    @Transactional
    public StatusDescriptor deactivate(String code) {
        return setActive(code, false);
    }

    @Transactional
    public StatusDescriptor activate(String code) {
        return setActive(code, true);
    }

    /**
     * Active statuses grouped by clinical category, categories in display order,
     * statuses by display name within each group.
     */
    @Transactional(readOnly = true)
    public List<StatusGroup> listActive() {
        Map<StatusCategory, List<StatusDescriptor>> grouped = new EnumMap<>(StatusCategory.class);
        for (BuiltInStatus builtIn : BuiltInStatus.values()) {
            grouped.computeIfAbsent(builtIn.getCategory(), k -> new ArrayList<>()).add(toDescriptor(builtIn));
        }
        for (CustomStatus customStatus : customStatusRepository.findByActiveTrueOrderByDisplayNameAsc()) {
            grouped.computeIfAbsent(customStatus.getCategory(), k -> new ArrayList<>()).add(toDescriptor(customStatus));
        }

        List<StatusGroup> groups = new ArrayList<>();
        for (Map.Entry<StatusCategory, List<StatusDescriptor>> entry : grouped.entrySet()) {
            List<StatusDescriptor> statuses = entry.getValue();
            statuses.sort(Comparator.comparing(StatusDescriptor::getDisplayName, String.CASE_INSENSITIVE_ORDER));
            groups.add(StatusGroup.builder()
                    .category(entry.getKey())
                    .label(entry.getKey().getLabel())
                    .statuses(statuses)
                    .build());
        }
        return groups;
    }

    @Transactional(readOnly = true)
    public List<StatusDescriptor> listCustom() {
        return customStatusRepository.findAllByOrderByDisplayNameAsc().stream()
                .map(this::toDescriptor)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<CustomStatus> findCustomStatus(String code) {
        return customStatusRepository.findByCodeIgnoreCase(normalize(code));
    }

    public long countActive() {
        return BuiltInStatus.values().length + customStatusRepository.findByActiveTrueOrderByDisplayNameAsc().size();
    }

    private StatusDescriptor setActive(String code, boolean active) {
        CustomStatus customStatus = findCustom(code);
        if (customStatus.isActive() == active) {
            return toDescriptor(customStatus);
        }
        customStatus.setActive(active);
        CustomStatus saved = customStatusRepository.save(customStatus);
        log.info("Custom status {} {}", saved.getCode(), active ? "activated" : "deactivated");
        return toDescriptor(saved);
    }

    private CustomStatus findCustom(String code) {
        String normalized = normalize(code);
        if (BuiltInStatus.isBuiltIn(normalized)) {
            throw new ApiException("Built-in statuses cannot be modified", HttpStatus.BAD_REQUEST, "BUILT_IN_STATUS");
        }
        return customStatusRepository.findByCodeIgnoreCase(normalized)
                .orElseThrow(() -> new ResourceNotFoundException("CustomStatus", "code", code));
    }

    private String validateColor(String color) {
        if (color == null || color.isBlank()) {
            return Constants.FALLBACK_STATUS_COLOR;
        }
        String trimmed = color.trim();
        if (!COLOR_PATTERN.matcher(trimmed).matches()) {
            throw ValidationException.forField("customStatus", "color", "Color must be a hex value like #A1B2C3");
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    private static String normalize(String code) {
        return code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
    }

    private StatusDescriptor toDescriptor(BuiltInStatus builtIn) {
        return StatusDescriptor.builder()
                .code(builtIn.getCode())
                .displayName(builtIn.getDisplayName())
                .color(builtIn.getColor())
                .category(builtIn.getCategory())
                .builtIn(true)
                .active(true)
                .build();
    }

    private StatusDescriptor toDescriptor(CustomStatus customStatus) {
        return StatusDescriptor.builder()
                .code(customStatus.getCode())
                .displayName(customStatus.getDisplayName())
                .color(customStatus.getColor())
                .category(customStatus.getCategory())
                .builtIn(false)
                .active(customStatus.isActive())
                .build();
    }
}
