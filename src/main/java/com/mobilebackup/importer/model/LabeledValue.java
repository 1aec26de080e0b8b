package com.mobilebackup.importer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 联系人多值属性：(label, value)，例如 ("mobile", "+1 941 518 0701") */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LabeledValue {
    private String label;
    private String value;
}
