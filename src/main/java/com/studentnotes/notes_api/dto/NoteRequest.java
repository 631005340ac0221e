package com.studentnotes.notes_api.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * 노트 생성/수정 요청 DTO (POST, PUT 공통)
 * - title, content: 필수, 공백만 있는 문자열 불가
 * - tags: 선택, 있으면 문자열 배열
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NoteRequest {

    public static final String TITLE_MESSAGE = "Title is required and must be a non-empty string";
    public static final String CONTENT_MESSAGE = "Content is required and must be a non-empty string";
    public static final String TAGS_MESSAGE = "Tags must be an array of strings";
    public static final String TAG_ELEMENT_MESSAGE = "All tags must be strings";

    @JsonDeserialize(using = StrictStringDeserializer.class)
    @NotBlank(message = TITLE_MESSAGE)
    private String title;

    @JsonDeserialize(using = StrictStringDeserializer.class)
    @NotBlank(message = CONTENT_MESSAGE)
    private String content;

    @JsonDeserialize(contentUsing = StrictStringDeserializer.class)
    private List<@NotNull(message = TAG_ELEMENT_MESSAGE) String> tags;
}
