package com.admissionsgenie.admission.casemix;

/** Collapsed clinical categories used for the PT and OT components. */
public enum TherapyCategory {
    MAJOR_JOINT_REPLACEMENT_OR_SPINAL_SURGERY,
    OTHER_ORTHOPEDIC,
    MEDICAL_MANAGEMENT,
    NON_ORTHOPEDIC_SURGERY_AND_ACUTE_NEUROLOGIC
}
