package com.adlanda.perema.model;

import jakarta.validation.groups.Default;

/**
 * Validation group for constraints that only apply when a resource is created.
 * Updates merge into the stored record, so required fields may be omitted there.
 */
public interface OnCreate extends Default {
}
