package com.mobilebackup.importer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String errorCode;
    private String message;
    /** 仅冷却拒绝时有值 */
    private Long retryAfterSeconds;
}
