package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ServiceCategory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tags a service with its clinical category by keyword. Categories are checked in
 * declaration order, so "dialysis surgery" is DIALYSIS rather than SURGERY.
 */
public class ServiceCategorizer {

    private static final Map<ServiceCategory, Pattern> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(ServiceCategory.DIALYSIS, words(
                "dialysis", "haemodialysis", "hemodialysis", "renal replacement", "peritoneal"));
        KEYWORDS.put(ServiceCategory.ONCOLOGY, words(
                "cancer", "oncology", "chemotherapy", "chemo", "radiotherapy", "tumou?r", "palliative"));
        KEYWORDS.put(ServiceCategory.MATERNITY, words(
                "maternity", "delivery", "deliveries", "ca?esarean", "c-section", "antenatal", "postnatal",
                "obstetric", "midwifery"));
        KEYWORDS.put(ServiceCategory.MENTAL_HEALTH, words(
                "mental", "psychiatric", "psychiatry", "psychology", "psychotherapy", "counsell?ing",
                "depression", "substance use"));
        KEYWORDS.put(ServiceCategory.REHABILITATION, words(
                "rehabilitation", "rehab", "physiotherapy", "physio", "occupational therapy",
                "speech therapy", "stroke"));
        KEYWORDS.put(ServiceCategory.IMAGING, words(
                "imaging", "x-ray", "xray", "mri", "ct scan", "ultrasound", "radiology", "mammogra(?:m|phy)"));
        KEYWORDS.put(ServiceCategory.SURGERY, words(
                "surgery", "surgical", "operation", "theatre", "theater", "procedure"));
        KEYWORDS.put(ServiceCategory.EMERGENCY, words(
                "emergency", "casualty", "ambulance", "trauma", "accident", "evacuation"));
        KEYWORDS.put(ServiceCategory.OUTPATIENT, words(
                "outpatient", "out-patient", "consultation", "clinic", "general practitioner"));
        KEYWORDS.put(ServiceCategory.FACILITY, words(
                "level \\d", "levels \\d", "tier \\d", "dispensar(?:y|ies)", "health cent(?:re|er)",
                "facility", "facilities"));
    }

    private static Pattern words(String... keywords) {
        return Pattern.compile(List.of(keywords).stream()
                .collect(Collectors.joining("|", "(?i)\\b(?:", ")\\b")));
    }

    /**
     * @param description service description
     * @param rawText     full source row, consulted when the description is not conclusive
     * @param hint        extractor's category hint, used when it names a known category
     */
    public ServiceCategory categorize(String description, String rawText, String hint) {
        return ServiceCategory.fromHint(hint)
                .orElseGet(() -> {
                    ServiceCategory fromDescription = byKeyword(description);
                    return fromDescription != ServiceCategory.OTHER ? fromDescription : byKeyword(rawText);
                });
    }

    ServiceCategory byKeyword(String text) {
        if (text == null || text.isBlank()) {
            return ServiceCategory.OTHER;
        }
        for (Map.Entry<ServiceCategory, Pattern> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return entry.getKey();
            }
        }
        return ServiceCategory.OTHER;
    }
}
