package com.example.studydesign.domain;

import java.util.List;

/**
 * Drug under study: international nonproprietary name plus dosage and form.
 *
 * @param innEn                international name (English), used for literature search
 * @param innRu                optional localized name
 * @param dosage               e.g. "400 mg"
 * @param dosageForm           e.g. "film-coated tablets"
 * @param additionalSubstances optional extra search terms
 */
public record DrugIdentifier(
        String innEn,
        String innRu,
        String dosage,
        String dosageForm,
        List<String> additionalSubstances
) {

    public DrugIdentifier {
        additionalSubstances = additionalSubstances == null ? List.of() : List.copyOf(additionalSubstances);
    }

    public DrugIdentifier(String innEn, String dosage, String dosageForm) {
        this(innEn, null, dosage, dosageForm, List.of());
    }
}
