package com.al.clinicalconverter.repository;

import com.al.clinicalconverter.model.NormalizedPatient;

import java.util.Optional;

public interface PatientStore {

    /**
     * Creates the patient, or updates the stored one with the non-empty
     * values of {@code patient}.
     *
     * @return id of the stored patient; empty when {@code patient} has no
     *         patient id
     */
    Optional<String> getOrCreatePatient(NormalizedPatient patient);
}
