package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.dto.request.CustomStatusRequest;
import com.DentalCare.chart_backend.dto.request.CustomStatusUpdateRequest;
import com.DentalCare.chart_backend.dto.response.StatusDescriptor;
import com.DentalCare.chart_backend.dto.response.StatusGroup;
import com.DentalCare.chart_backend.enums.StatusCategory;
import com.DentalCare.chart_backend.exception.ApiException;
import com.DentalCare.chart_backend.exception.DuplicateStatusException;
import com.DentalCare.chart_backend.exception.UnknownStatusException;
import com.DentalCare.chart_backend.exception.ValidationException;
import com.DentalCare.chart_backend.model.CustomStatus;
import com.DentalCare.chart_backend.repository.CustomStatusRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StatusRegistryServiceTest {

    @Mock
    private CustomStatusRepository customStatusRepository;

    @InjectMocks
    private StatusRegistryService statusRegistryService;

    private CustomStatus customStatus(String code, boolean active) {
        return CustomStatus.builder()
                .id(1L)
                .code(code)
                .displayName("Implant Failure")
                .color("#AA0000")
                .category(StatusCategory.HARD_TISSUE)
                .active(active)
                .build();
    }

    @Test
    void registerCustom_BuiltInCodeInAnyCase_ThrowsDuplicate() {
        CustomStatusRequest request = CustomStatusRequest.builder()
                .code("  Caries_DEEP ")
                .displayName("Deep caries again")
                .build();

        DuplicateStatusException exception = assertThrows(DuplicateStatusException.class,
                () -> statusRegistryService.registerCustom(request));

        assertEquals("DUPLICATE_STATUS", exception.getErrorCode());
        verify(customStatusRepository, never()).save(any());
    }

    @Test
    void registerCustom_ExistingCustomCode_ThrowsDuplicate() {
        when(customStatusRepository.existsByCodeIgnoreCase("implant_failure")).thenReturn(true);

        CustomStatusRequest request = CustomStatusRequest.builder()
                .code("Implant_Failure")
                .displayName("Implant Failure")
                .build();

        assertThrows(DuplicateStatusException.class, () -> statusRegistryService.registerCustom(request));
    }

    @Test
    void registerCustom_Valid_StoresNormalizedCodeAndColor() {
        when(customStatusRepository.save(any(CustomStatus.class))).thenAnswer(inv -> inv.getArgument(0));

        StatusDescriptor descriptor = statusRegistryService.registerCustom(CustomStatusRequest.builder()
                .code(" Implant_Failure ")
                .displayName(" Implant Failure ")
                .color("#aa0000")
                .category(StatusCategory.HARD_TISSUE)
                .build());

        assertEquals("implant_failure", descriptor.getCode());
        assertEquals("Implant Failure", descriptor.getDisplayName());
        assertEquals("#AA0000", descriptor.getColor());
        assertFalse(descriptor.isBuiltIn());
        assertTrue(descriptor.isActive());
    }

    @Test
    void registerCustom_MissingColor_UsesFallbackGrey() {
        when(customStatusRepository.save(any(CustomStatus.class))).thenAnswer(inv -> inv.getArgument(0));

        StatusDescriptor descriptor = statusRegistryService.registerCustom(CustomStatusRequest.builder()
                .code("veneer")
                .displayName("Veneer")
                .build());

        assertEquals("#808080", descriptor.getColor());
        assertEquals(StatusCategory.OTHER, descriptor.getCategory());
    }

    @Test
    void registerCustom_BadColor_ThrowsValidation() {
        CustomStatusRequest request = CustomStatusRequest.builder()
                .code("veneer")
                .displayName("Veneer")
                .color("red")
                .build();

        assertThrows(ValidationException.class, () -> statusRegistryService.registerCustom(request));
        verify(customStatusRepository, never()).save(any());
    }

    @Test
    void registerCustom_MalformedCode_ThrowsValidation() {
        CustomStatusRequest request = CustomStatusRequest.builder()
                .code("9-bad code")
                .displayName("Bad")
                .build();

        assertThrows(ValidationException.class, () -> statusRegistryService.registerCustom(request));
    }

    @Test
    void resolve_BuiltInCode_IsCaseInsensitive() {
        StatusDescriptor descriptor = statusRegistryService.resolve("MISSING");

        assertEquals("missing", descriptor.getCode());
        assertTrue(descriptor.isBuiltIn());
        verifyNoInteractions(customStatusRepository);
    }

    @Test
    void resolve_InactiveCustom_ThrowsUnknownStatus() {
        when(customStatusRepository.findByCodeIgnoreCase("implant_failure"))
                .thenReturn(Optional.of(customStatus("implant_failure", false)));

        assertThrows(UnknownStatusException.class, () -> statusRegistryService.resolve("implant_failure"));
    }

    @Test
    void resolve_UnknownCode_ThrowsUnknownStatus() {
        assertThrows(UnknownStatusException.class, () -> statusRegistryService.resolve("not_a_status"));
    }

    @Test
    void describe_InactiveCustom_StillResolves() {
        when(customStatusRepository.findByCodeIgnoreCase("implant_failure"))
                .thenReturn(Optional.of(customStatus("implant_failure", false)));

        StatusDescriptor descriptor = statusRegistryService.describe("implant_failure");

        assertEquals("#AA0000", descriptor.getColor());
        assertFalse(descriptor.isActive());
    }

    @Test
    void describe_UnknownCode_ReturnsFallbackGrey() {
        StatusDescriptor descriptor = statusRegistryService.describe("legacy_code");

        assertEquals("legacy_code", descriptor.getCode());
        assertEquals("#808080", descriptor.getColor());
        assertEquals(StatusCategory.OTHER, descriptor.getCategory());
    }

    @Test
    void validateCodes_DuplicatesInMixedCase_ReturnsOrderedDistinctCodes() {
        List<String> codes = statusRegistryService.validateCodes(Arrays.asList("Caries_Deep", "filling", "caries_deep"));

        assertEquals(List.of("caries_deep", "filling"), codes);
    }

    @Test
    void validateCodes_Empty_ThrowsValidation() {
        assertThrows(ValidationException.class, () -> statusRegistryService.validateCodes(List.of()));
    }

    @Test
    void validateCodes_BlankEntry_ThrowsValidation() {
        assertThrows(ValidationException.class,
                () -> statusRegistryService.validateCodes(Arrays.asList("filling", " ")));
    }

    @Test
    void listActive_GroupsInFixedCategoryOrder() {
        when(customStatusRepository.findByActiveTrueOrderByDisplayNameAsc())
                .thenReturn(List.of(customStatus("implant_failure", true)));

        List<StatusGroup> groups = statusRegistryService.listActive();

        assertEquals(StatusCategory.HARD_TISSUE, groups.get(0).getCategory());
        assertEquals(StatusCategory.OTHER, groups.get(groups.size() - 1).getCategory());
        for (int i = 1; i < groups.size(); i++) {
            assertTrue(groups.get(i - 1).getCategory().ordinal() < groups.get(i).getCategory().ordinal());
        }
        assertTrue(groups.get(0).getStatuses().stream()
                .anyMatch(status -> status.getCode().equals("implant_failure")));
    }

    @Test
    void update_BuiltInStatus_IsRejected() {
        CustomStatusUpdateRequest request = new CustomStatusUpdateRequest();
        request.setDisplayName("Gone");

        ApiException exception = assertThrows(ApiException.class,
                () -> statusRegistryService.update("missing", request));

        assertEquals("BUILT_IN_STATUS", exception.getErrorCode());
    }

    @Test
    void deactivate_ActiveCustom_HidesFromSelection() {
        CustomStatus status = customStatus("implant_failure", true);
        when(customStatusRepository.findByCodeIgnoreCase("implant_failure")).thenReturn(Optional.of(status));
        when(customStatusRepository.save(status)).thenReturn(status);

        StatusDescriptor descriptor = statusRegistryService.deactivate("Implant_Failure");

        assertFalse(descriptor.isActive());
        assertFalse(status.isActive());
    }
}
