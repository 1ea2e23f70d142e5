package com.cario.clinical.safety.schema;

import static com.cario.clinical.safety.schema.FieldSpec.disclaimer;
import static com.cario.clinical.safety.schema.FieldSpec.object;
import static com.cario.clinical.safety.schema.FieldSpec.objectList;
import static com.cario.clinical.safety.schema.FieldSpec.text;
import static com.cario.clinical.safety.schema.FieldSpec.textList;

import com.cario.clinical.safety.model.DocumentKind;
import com.cario.clinical.safety.vocabulary.DisclaimerRegistry;
import java.util.List;

/**
 * Closed schemas of every {@link DocumentKind}:
 *
 * <ul>
 *   <li>imaging_findings: image type/quality, anatomical observations keyed by region, comparison,
 *       highlighted areas
 *   <li>lab_results: document header fields and test categories with individual test values
 *   <li>clinical_note: SOAP sections (subjective, objective with vital signs, assessment, plan)
 * </ul>
 *
 * <p>Each schema also fixes the free-text fields that must be scanned, so nothing the model adds
 * can escape scanning: a key that is not declared here is a rejection.
 */
public final class DocumentSchemas {

  /** Region keys accepted under {@code anatomical_observations}. */
  static final String[] IMAGING_REGIONS = {
    "lungs",
    "pleural_regions",
    "pleura",
    "cardiomediastinal_silhouette",
    "heart",
    "mediastinum",
    "hila",
    "airway",
    "diaphragm",
    "bones",
    "spine",
    "joints",
    "soft_tissues",
    "abdomen",
    "bowel_gas_pattern",
    "liver",
    "gallbladder",
    "kidneys",
    "bladder",
    "uterus",
    "fetal_structures",
    "amniotic_fluid",
    "cardiac_chambers",
    "lines_and_tubes",
    "other"
  };

  private static final ObjectSpec IMAGING_FINDINGS =
      ObjectSpec.of(
          text("image_type", true),
          text("image_quality", true),
          FieldSpec.builder()
              .name("anatomical_observations")
              .type(FieldType.KEYED_TEXT_LISTS)
              .required(true)
              .allowedKeys(List.of(IMAGING_REGIONS))
              .build(),
          text("comparison_with_prior", true),
          text("areas_highlighted", true),
          disclaimer(DisclaimerRegistry.DISCLAIMER_FIELD));

  private static final ObjectSpec LAB_TEST =
      ObjectSpec.of(
          text("test_name", true),
          FieldSpec.of("value", FieldType.SCALAR, true),
          text("unit", false),
          text("reference_range", false),
          text("method", false));

  private static final ObjectSpec LAB_CATEGORY =
      ObjectSpec.of(text("category", true), objectList("tests", 1, LAB_TEST));

  private static final ObjectSpec LAB_RESULTS =
      ObjectSpec.of(
          FieldSpec.builder()
              .name("document_type")
              .type(FieldType.ENUM)
              .required(true)
              .allowedValue("laboratory_report")
              .allowedValue("lab")
              .build(),
          text("document_date", false),
          text("laboratory_name", false),
          text("patient_identifier", false),
          text("ordering_provider", false),
          objectList("test_categories", 1, LAB_CATEGORY),
          text("notes", false),
          disclaimer(DisclaimerRegistry.DISCLAIMER_FIELD));

  private static final ObjectSpec VITAL_SIGNS =
      ObjectSpec.of(
          FieldSpec.of("temperature", FieldType.NUMBER, false),
          FieldSpec.of("heart_rate", FieldType.NUMBER, false),
          FieldSpec.of("respiratory_rate", FieldType.NUMBER, false),
          FieldSpec.of("systolic_bp", FieldType.INTEGER, false),
          FieldSpec.of("diastolic_bp", FieldType.INTEGER, false),
          FieldSpec.of("oxygen_saturation", FieldType.INTEGER, false),
          FieldSpec.of("recorded_at", FieldType.TIMESTAMP, true));

  private static final ObjectSpec CLINICAL_NOTE =
      ObjectSpec.of(
          text("patient_identifier", false),
          object(
              "subjective",
              true,
              ObjectSpec.of(
                  text("chief_complaint", true),
                  text("history_of_present_illness", false),
                  textList("past_medical_history"),
                  textList("medications"),
                  textList("allergies"))),
          object(
              "objective",
              true,
              ObjectSpec.of(
                  object("vital_signs", false, VITAL_SIGNS),
                  textList("physical_exam_findings"),
                  textList("diagnostic_results"))),
          object(
              "assessment",
              true,
              ObjectSpec.of(
                  text("clinical_impression", true),
                  textList("differential_considerations"),
                  textList("problem_list"))),
          object(
              "plan",
              true,
              ObjectSpec.of(
                  textList("interventions"),
                  textList("follow_up"),
                  textList("patient_education"),
                  textList("referrals"))),
          disclaimer(DisclaimerRegistry.DISCLAIMER_FIELD));

  private DocumentSchemas() {}

  public static ObjectSpec forKind(DocumentKind kind) {
    return switch (kind) {
      case IMAGING_FINDINGS -> IMAGING_FINDINGS;
      case LAB_RESULTS -> LAB_RESULTS;
      case CLINICAL_NOTE -> CLINICAL_NOTE;
    };
  }
}
