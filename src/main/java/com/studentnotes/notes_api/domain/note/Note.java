package com.studentnotes.notes_api.domain.note;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 노트 도메인 객체
 *
 * - id, createdAt 은 생성 이후 변경되지 않는다.
 * - title, content, tags 는 updateNote 로만 교체되며 그때마다 updatedAt 이 갱신된다.
 * - 파일 저장 시 필드명 그대로 JSON 으로 직렬화된다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Note {

    private Long id;

    private String title;

    private String content;

    private List<String> tags = new ArrayList<>();

    private Instant createdAt;

    private Instant updatedAt;

    @Builder(toBuilder = true)
    public Note(Long id, String title, String content, List<String> tags, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.title = title;
        this.content = content;
        this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Note makeNote(Long id, String title, String content, List<String> tags, Instant now) {
        return Note.builder()
                .id(id)
                .title(title.trim())
                .content(content.trim())
                .tags(trimAll(tags))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    // 락 밖으로 내보낼 때 쓰는 복사본. tags 리스트도 새로 만든다
    public Note snapshot() {
        return toBuilder().build();
    }

    public void updateNote(String title, String content, List<String> tags, Instant now) {
        this.title = title.trim();
        this.content = content.trim();
        this.tags = trimAll(tags);
        this.updatedAt = now;
    }

    // 태그 중 하나라도 keyword 를 포함하면 true (대소문자 무시)
    public boolean hasTagContaining(String keyword) {
        if (tags == null) {
            return false;
        }
        String lowered = keyword.toLowerCase(Locale.ROOT);
        return tags.stream()
                .anyMatch(tag -> tag != null && tag.toLowerCase(Locale.ROOT).contains(lowered));
    }

    // 제목 또는 본문에 keyword 가 포함되면 true (대소문자 무시)
    public boolean mentions(String keyword) {
        String lowered = keyword.toLowerCase(Locale.ROOT);
        return containsIgnoreCase(title, lowered) || containsIgnoreCase(content, lowered);
    }

    private static boolean containsIgnoreCase(String text, String loweredKeyword) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(loweredKeyword);
    }

    private static List<String> trimAll(List<String> tags) {
        List<String> trimmed = new ArrayList<>();
        if (tags == null) {
            return trimmed;
        }
        for (String tag : tags) {
            trimmed.add(tag.trim());
        }
        return trimmed;
    }

}
