package com.studentnotes.notes_api.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 모든 실패 응답의 본문: {"error": "..."}
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class ErrorResponse {

    private String error;
}
