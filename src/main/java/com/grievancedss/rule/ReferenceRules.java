package com.grievancedss.rule;

import java.util.List;

import static com.grievancedss.rule.AuthorityTier.L1_NATIONAL;
import static com.grievancedss.rule.AuthorityTier.L2_ACCREDITATION;
import static com.grievancedss.rule.AuthorityTier.L3_UNIVERSITY;
import static com.grievancedss.rule.Conditions.atLeast;
import static com.grievancedss.rule.Conditions.atMost;
import static com.grievancedss.rule.Conditions.grievanceType;
import static com.grievancedss.rule.Conditions.greaterThan;
import static com.grievancedss.rule.Conditions.isFalse;
import static com.grievancedss.rule.Conditions.isTrue;
import static com.grievancedss.rule.Conditions.lessThan;
import static com.grievancedss.rule.Conditions.oneOf;

/**
 * Reference regulations shipped with the service: national (UGC / Ministry
 * of Education), accreditation (AICTE) and university provisions for the
 * attendance, examination, fee and transcript grievance types.
 */
public final class ReferenceRules {

    public static final String ATTENDANCE_SHORTAGE = "ATTENDANCE_SHORTAGE";
    public static final String EXAMINATION_REEVAL = "EXAMINATION_REEVAL";
    public static final String FEE_WAIVER = "FEE_WAIVER";
    public static final String TRANSCRIPT_DELAY = "TRANSCRIPT_DELAY";

    private ReferenceRules() {
    }

    public static List<Rule> defaults() {
        return List.of(
            // Attendance
            Rule.builder("UGC_Attendance_75Percent_Minimum")
                .tier(L1_NATIONAL).salience(1500).effectiveDate("2018-07-01")
                .when(grievanceType(ATTENDANCE_SHORTAGE))
                .when(lessThan("attendance_percentage", 75))
                .then(facts -> RuleOutcome.of(DecisionOutcome.REJECT,
                    "Attendance " + param(facts, "attendance_percentage")
                        + "% is below the UGC-mandated 75% minimum",
                    "UGC Regulations 2018, Section 4.2"))
                .description("Minimum 75% attendance for semester eligibility")
                .build(),
            Rule.builder("UGC_Attendance_Satisfied")
                .tier(L1_NATIONAL).salience(1500).effectiveDate("2018-07-01")
                .when(grievanceType(ATTENDANCE_SHORTAGE))
                .when(atLeast("attendance_percentage", 75))
                .then(facts -> RuleOutcome.of(DecisionOutcome.ACCEPT,
                    "Attendance " + param(facts, "attendance_percentage")
                        + "% meets the UGC requirement",
                    "UGC Regulations 2018, Section 4.2"))
                .description("Attendance at or above the national minimum")
                .build(),
            Rule.builder("UGC_Medical_Excuse_Exception")
                .tier(L1_NATIONAL).salience(1600).effectiveDate("2018-07-01")
                .when(grievanceType(ATTENDANCE_SHORTAGE))
                .when(isTrue("has_medical_certificate"))
                .when(isTrue("medical_certificate_from_recognized_authority"))
                .when(atLeast("attendance_percentage", 65))
                .when(lessThan("attendance_percentage", 75))
                .then(RuleOutcome.of(DecisionOutcome.ACCEPT,
                        "Attendance relaxation to 65% granted on a certificate from a recognised medical authority",
                        "UGC Regulations 2018, Section 4.2.1")
                    .withActionRequired("Submit the original medical certificate for verification"))
                .description("Relaxation to 65% with a certificate from a recognised medical authority")
                .build(),
            Rule.builder("AICTE_Technical_Lab_Attendance")
                .tier(L2_ACCREDITATION).salience(900).effectiveDate("2019-07-01")
                .when(grievanceType(ATTENDANCE_SHORTAGE))
                .when(isTrue("is_technical_course"))
                .when(lessThan("lab_attendance_percentage", 80))
                .then(facts -> RuleOutcome.of(DecisionOutcome.REJECT,
                    "Laboratory attendance " + param(facts, "lab_attendance_percentage")
                        + "% is below the 80% required for technical programmes",
                    "AICTE Approval Process Handbook 2019, Chapter 7"))
                .description("Minimum 80% laboratory attendance for technical programmes")
                .build(),
            Rule.builder("University_Medical_Excuse_Attendance")
                .tier(L3_UNIVERSITY).salience(300).effectiveDate("2020-01-01")
                .when(grievanceType(ATTENDANCE_SHORTAGE))
                .when(isTrue("has_medical_certificate"))
                .when(atLeast("attendance_percentage", 65))
                .then(RuleOutcome.of(DecisionOutcome.ACCEPT,
                    "University medical excuse policy relaxes attendance with a valid medical certificate",
                    "University Statute 2020, Chapter 5, Section 5.3"))
                .description("University relaxation with a medical certificate, subject to national law")
                .build(),

            // Examination
            Rule.builder("UGC_Examination_Revaluation_Right")
                .tier(L1_NATIONAL).salience(1400).effectiveDate("2018-07-01")
                .when(grievanceType(EXAMINATION_REEVAL))
                .when(atMost("days_since_result_declaration", 15))
                .when(isTrue("revaluation_fee_paid"))
                .then(RuleOutcome.of(DecisionOutcome.ACCEPT,
                    "Revaluation requested within 15 days of result declaration with the fee paid",
                    "UGC Regulations 2018, Section 6.3"))
                .description("Right to re-evaluation within 15 days of result declaration")
                .build(),
            Rule.builder("UGC_Revaluation_Deadline_Lapsed")
                .tier(L1_NATIONAL).salience(1400).effectiveDate("2018-07-01")
                .when(grievanceType(EXAMINATION_REEVAL))
                .when(greaterThan("days_since_result_declaration", 15))
                .then(facts -> RuleOutcome.of(DecisionOutcome.REJECT,
                    "Revaluation requested " + param(facts, "days_since_result_declaration")
                        + " days after result declaration (deadline: 15 days)",
                    "UGC Regulations 2018, Section 6.3"))
                .description("Revaluation window closes 15 days after result declaration")
                .build(),
            Rule.builder("University_Exam_Policy_Reeval_Fee")
                .tier(L3_UNIVERSITY).salience(320).effectiveDate("2023-01-01")
                .when(grievanceType(EXAMINATION_REEVAL))
                .when(atMost("days_since_result_declaration", 15))
                .when(isFalse("revaluation_fee_paid"))
                .then(RuleOutcome.of(DecisionOutcome.PENDING_CLARIFICATION,
                        "Revaluation fee payment is required before the request can proceed",
                        "University Examination Policy 2023, Section 7.1")
                    .withActionRequired("Pay revaluation fee"))
                .description("Re-evaluation fee per course")
                .build(),
            Rule.builder("University_Grade_Appeal_Process")
                .tier(L3_UNIVERSITY).salience(310).effectiveDate("2021-08-01")
                .when(grievanceType(EXAMINATION_REEVAL))
                .when(atMost("marks_from_next_grade_boundary", 5))
                .then(RuleOutcome.of(DecisionOutcome.PARTIAL_ACCEPT,
                        "Marks are within 5% of the next grade boundary; grade appeal permitted",
                        "University Academic Regulations 2021, Section 8.4")
                    .withActionRequired("Attend the grade appeal hearing"))
                .description("Grade appeal when marks are within 5% of the next boundary")
                .build(),

            // Fees
            Rule.builder("Right_To_Education_Fee_Waiver_SC_ST")
                .tier(L1_NATIONAL).salience(1700).effectiveDate("2009-08-26")
                .when(grievanceType(FEE_WAIVER))
                .when(oneOf("student_category", "SC", "ST"))
                .when(lessThan("family_income", 200_000))
                .then(RuleOutcome.of(DecisionOutcome.ACCEPT,
                    "SC/ST student with family income below the national threshold is eligible for a full fee waiver",
                    "Right to Education Act 2009, Section 12(1)(c)"))
                .description("Fee waiver for SC/ST students with family income below 200,000 per annum")
                .build(),
            Rule.builder("National_EWS_Fee_Waiver")
                .tier(L1_NATIONAL).salience(1400).effectiveDate("2019-02-01")
                .when(grievanceType(FEE_WAIVER))
                .when(oneOf("student_category", "EWS"))
                .when(lessThan("family_income", 800_000))
                .when(isTrue("has_income_certificate"))
                .then(RuleOutcome.of(DecisionOutcome.ACCEPT,
                    "EWS student with certified family income below the threshold",
                    "UGC Fee Waiver Guidelines 2019"))
                .description("Fee waiver for certified EWS students")
                .build(),
            Rule.builder("University_Fee_Structure_Installment_Policy")
                .tier(L3_UNIVERSITY).salience(350).effectiveDate("2022-07-01")
                .when(grievanceType(FEE_WAIVER))
                .when(lessThan("family_income", 500_000))
                .then(RuleOutcome.of(DecisionOutcome.PARTIAL_ACCEPT,
                        "Fee may be paid in three instalments",
                        "University Fee Policy 2022, Section 3.2")
                    .withActionRequired("Submit the instalment plan form"))
                .description("Three-instalment payment for family income below 500,000")
                .build(),
            Rule.builder("University_Fee_Waiver_Ineligibility")
                .tier(L3_UNIVERSITY).salience(500).effectiveDate("2022-07-01")
                .when(grievanceType(FEE_WAIVER))
                .when(oneOf("student_category", "GENERAL", "OBC"))
                .when(atLeast("family_income", 500_000))
                .then(RuleOutcome.of(DecisionOutcome.REJECT,
                    "Does not meet fee waiver criteria",
                    "University Fee Policy 2022, Section 2.1"))
                .description("No waiver above the instalment income limit for unreserved categories")
                .build(),

            // Transcripts: the 2016 timeline was superseded in 2022 at the same salience
            Rule.builder("University_Transcript_Standard_Timeline")
                .tier(L3_UNIVERSITY).salience(280).effectiveDate("2016-06-01")
                .when(grievanceType(TRANSCRIPT_DELAY))
                .when(atMost("delay_days", 45))
                .then(RuleOutcome.of(DecisionOutcome.REJECT,
                    "Transcript is still within the 45-day standard processing window",
                    "University Administrative Policy 2016, Section 12.1"))
                .description("Standard transcript processing window of 45 days")
                .build(),
            Rule.builder("University_Transcript_Delay_Compensation")
                .tier(L3_UNIVERSITY).salience(280).effectiveDate("2022-01-01")
                .when(grievanceType(TRANSCRIPT_DELAY))
                .when(greaterThan("delay_days", 30))
                .then(RuleOutcome.of(DecisionOutcome.ACCEPT,
                        "Transcript delay exceeds 30 days; expedited processing granted",
                        "University Administrative Policy 2022, Section 12.5")
                    .withActionRequired("Registrar to issue the transcript within 7 days"))
                .description("Expedited processing when the delay exceeds 30 days")
                .build()
        );
    }

    private static Object param(GrievanceFacts facts, String key) {
        return facts.get(key).orElse("unknown");
    }
}
