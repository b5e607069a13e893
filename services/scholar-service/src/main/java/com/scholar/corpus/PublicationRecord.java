package com.scholar.corpus;

import java.time.LocalDate;
import java.util.List;

/**
 * One crawled publication. {@code publishedDate} is the raw value from the source; {@code publishedOn} is its
 * parsed form, or {@code null} when the raw value could not be read as a date.
 */
public record PublicationRecord(
    String title,
    String link,
    List<Author> authors,
    String publishedDate,
    LocalDate publishedOn,
    String abstractText
) {
    public PublicationRecord {
        title = title == null ? "" : title;
        authors = authors == null ? List.of() : List.copyOf(authors);
        publishedDate = publishedDate == null ? "" : publishedDate;
        abstractText = abstractText == null ? "" : abstractText;
    }

    public String searchableText() {
        StringBuilder builder = new StringBuilder(title);
        for (Author author : authors) {
            if (author.name() != null) {
                builder.append(' ').append(author.name());
            }
        }
        return builder.append(' ').append(abstractText).toString();
    }
}
