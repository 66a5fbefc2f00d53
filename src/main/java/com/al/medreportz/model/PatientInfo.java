package com.al.medreportz.model;

import com.al.medreportz.model.enums.Gender;
import lombok.Builder;
import lombok.Value;

/**
 * Patient demographics found in a report. Every field is independently nullable.
 */
@Value
@Builder
public class PatientInfo {
    String name;
    Integer age;
    Gender gender;

    public static PatientInfo empty() {
        return PatientInfo.builder().build();
    }
}
