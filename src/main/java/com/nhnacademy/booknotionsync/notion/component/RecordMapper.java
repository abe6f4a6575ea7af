package com.nhnacademy.booknotionsync.notion.component;

import com.nhnacademy.booknotionsync.catalog.dto.BookRecord;
import com.nhnacademy.booknotionsync.notion.dto.BookProperty;
import com.nhnacademy.booknotionsync.notion.dto.DestinationPayload;
import com.nhnacademy.booknotionsync.notion.dto.PropertyValue.DateValue;
import com.nhnacademy.booknotionsync.notion.dto.PropertyValue.ExternalFileValue;
import com.nhnacademy.booknotionsync.notion.dto.PropertyValue.RichTextValue;
import com.nhnacademy.booknotionsync.notion.dto.PropertyValue.TitleValue;
import com.nhnacademy.booknotionsync.util.BookSyncUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class RecordMapper {

    static final String COVER_FILE_NAME = "표지 이미지";

    // 값이 없는 속성은 아예 넣지 않는다 (빈 문자열로 덮어쓰지 않도록)
    public DestinationPayload toPayload(BookRecord record) {
        String title = record.title().isBlank() ? BookRecord.UNTITLED : record.title();
        DestinationPayload.Builder builder = DestinationPayload.builder()
                .put(BookProperty.TITLE, new TitleValue(title));

        if (!record.author().isEmpty()) {
            builder.put(BookProperty.AUTHOR, new RichTextValue(record.author()));
        }
        if (!record.publisher().isEmpty()) {
            builder.put(BookProperty.PUBLISHER, new RichTextValue(record.publisher()));
        }

        BookSyncUtils.normalizeDate(record.pubDate()).ifPresentOrElse(
                date -> builder.put(BookProperty.PUBLISHED_DATE, new DateValue(date)),
                () -> {
                    if (!record.pubDate().isEmpty()) {
                        log.debug("[RecordMapper] 출판일 형식을 해석할 수 없어 생략합니다. pubDate={}", record.pubDate());
                    }
                });

        String isbn = record.preferredIsbn();
        if (!isbn.isEmpty()) {
            builder.put(BookProperty.ISBN, new RichTextValue(isbn));
        }
        if (!record.coverImageUrl().isEmpty()) {
            builder.put(BookProperty.COVER_IMAGE, new ExternalFileValue(COVER_FILE_NAME, record.coverImageUrl()));
        }

        return builder.build();
    }
}
