package com.al.medreportz.service.extractor;

import com.al.medreportz.model.PatientInfo;
import com.al.medreportz.model.enums.Gender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class PatientInfoExtractor implements FieldExtractor<PatientInfo> {

    // Labels that end a name capture when they follow it on the same line
    private static final String NEXT_LABEL = "(?:Age|Gender|Sex|DOB|Date of Birth|Patient ID|UHID|Ref|Referred)\\b";

    private static final Pattern NAME = Pattern.compile(
            "\\bPatient Name *[:\\-]? *([A-Za-z .]+?)(?=[ ,]+" + NEXT_LABEL + "|[ ,]*\\n|[ ,]*$)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AGE = Pattern.compile(
            "\\bAge *[:\\-]? *(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern GENDER = Pattern.compile(
            "\\b(?:Gender|Sex) *[:\\-]? *(Male|Female)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public PatientInfo extract(String text) {
        if (text == null || text.isEmpty()) {
            return PatientInfo.empty();
        }
        PatientInfo.PatientInfoBuilder builder = PatientInfo.builder();

        Matcher name = NAME.matcher(text);
        if (name.find()) {
            String value = name.group(1).strip();
            if (!value.isEmpty()) {
                builder.name(value);
            }
        } else {
            log.debug("Patient name not found");
        }

        Matcher age = AGE.matcher(text);
        if (age.find()) {
            try {
                builder.age(Integer.parseInt(age.group(1)));
            } catch (NumberFormatException e) {
                log.debug("Age out of range: {}", age.group(1));
            }
        }

        Matcher gender = GENDER.matcher(text);
        if (gender.find()) {
            Gender.fromLabel(gender.group(1)).ifPresent(builder::gender);
        }

        return builder.build();
    }
}
