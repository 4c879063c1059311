package com.DentalCare.chart_backend.service;

import com.DentalCare.chart_backend.dto.request.PatientRequest;
import com.DentalCare.chart_backend.dto.response.PatientResponse;
import com.DentalCare.chart_backend.exception.ApiException;
import com.DentalCare.chart_backend.exception.ResourceNotFoundException;
import com.DentalCare.chart_backend.model.Patient;
import com.DentalCare.chart_backend.repository.PatientRepository;
import com.DentalCare.chart_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PatientService {

    private final PatientRepository patientRepository;
    private final ModelMapper modelMapper;

    public List<PatientResponse> getAllPatients() {
        return patientRepository.findAll().stream()
                .map(this::mapToPatientResponse)
                .collect(Collectors.toList());
    }

    public PatientResponse getPatientById(Long id) {
        return mapToPatientResponse(getPatient(id));
    }

    public Patient getPatient(Long id) {
        return patientRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Patient", "id", id));
    }

    public Optional<Patient> findByPhoneNumber(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) {
            return Optional.empty();
        }
        return patientRepository.findByPhoneNumber(phoneNumber.trim());
    }

    @Transactional
    public Patient register(PatientRequest request) {
        String phoneNumber = request.getPhoneNumber().trim();
        if (patientRepository.existsByPhoneNumber(phoneNumber)) {
            throw new ApiException("A patient with this phone number already exists",
                    HttpStatus.CONFLICT, "DUPLICATE_PATIENT");
        }

        Patient patient = Patient.builder()
                .patientCode(nextPatientCode())
                .fullName(request.getFullName().trim())
                .phoneNumber(phoneNumber)
                .email(blankToNull(request.getEmail()))
                .address(blankToNull(request.getAddress()))
                .dateOfBirth(request.getDateOfBirth())
                .build();

        Patient savedPatient = patientRepository.save(patient);
        log.info("Patient registered: {} ({})", savedPatient.getPatientCode(), savedPatient.getFullName());
        return savedPatient;
    }

    @Transactional
    public PatientResponse createPatient(PatientRequest request) {
        return mapToPatientResponse(register(request));
    }

    /**
     * Overwrites only the fields the request supplies. The phone number is the
     * import key and stays as it is.
     *
     * @return true when any field changed
     */
    @Transactional
    public boolean updateFields(Patient patient, PatientRequest request) {
        boolean changed = false;
        if (hasText(request.getFullName()) && !request.getFullName().trim().equals(patient.getFullName())) {
            patient.setFullName(request.getFullName().trim());
            changed = true;
        }
        if (hasText(request.getEmail()) && !request.getEmail().trim().equals(patient.getEmail())) {
            patient.setEmail(request.getEmail().trim());
            changed = true;
        }
        if (hasText(request.getAddress()) && !request.getAddress().trim().equals(patient.getAddress())) {
            patient.setAddress(request.getAddress().trim());
            changed = true;
        }
        if (request.getDateOfBirth() != null && !request.getDateOfBirth().equals(patient.getDateOfBirth())) {
            patient.setDateOfBirth(request.getDateOfBirth());
            changed = true;
        }
        if (changed) {
            patientRepository.save(patient);
            log.info("Patient updated: {}", patient.getPatientCode());
        }
        return changed;
    }

    @Transactional
    public PatientResponse updatePatient(Long id, PatientRequest request) {
        Patient patient = getPatient(id);
        String phoneNumber = request.getPhoneNumber() != null ? request.getPhoneNumber().trim() : null;
        if (hasText(phoneNumber) && !phoneNumber.equals(patient.getPhoneNumber())) {
            if (patientRepository.existsByPhoneNumber(phoneNumber)) {
                throw new ApiException("A patient with this phone number already exists",
                        HttpStatus.CONFLICT, "DUPLICATE_PATIENT");
            }
            patient.setPhoneNumber(phoneNumber);
        }
        updateFields(patient, request);
        return mapToPatientResponse(patientRepository.save(patient));
    }

    public PatientResponse mapToPatientResponse(Patient patient) {
        return modelMapper.map(patient, PatientResponse.class);
    }

    private String nextPatientCode() {
        long next = patientRepository.findMaxId() + 1;
        String code = formatCode(next);
        // Ids can be sparse after imports, so step past any code already taken
        while (patientRepository.existsByPatientCode(code)) {
            next++;
            code = formatCode(next);
        }
        return code;
    }

    private static String formatCode(long number) {
        return Constants.PATIENT_CODE_PREFIX + String.format("%0" + Constants.PATIENT_CODE_DIGITS + "d", number);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String blankToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }
}
