package com.flagship.gold_history.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Employee as delivered by the ERP employee extract.
 */
@Value
@Builder
public class Employee {
    String ref;
    String nationalId;
    String lastName;
    String firstName;
}
