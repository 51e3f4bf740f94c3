package com.largomodo.kormarc.builder;

import java.util.Objects;

/**
 * Typed input for {@link KormarcBuilder}. Optional values are {@code null} when unknown.
 * <p>
 * Only presence is enforced here; content rules (ISBN check digit, KDC format,
 * publication year range) are reported by {@link BookInfoValidator}.
 *
 * @param isbn        ISBN-10 or ISBN-13, hyphens allowed
 * @param title       title proper
 * @param author      main author, optional
 * @param publisher   publisher name, optional
 * @param pubYear     publication year as {@code YYYY} or {@code YYYYMM}, optional
 * @param pages       page count, optional
 * @param kdc         Korean Decimal Classification number, optional
 * @param category    publication category; {@link BookCategory#BOOK} when null
 * @param price       price in won, optional
 * @param description free-text description, optional
 */
public record BookInfo(String isbn, String title, String author, String publisher, String pubYear,
                       Integer pages, String kdc, BookCategory category, Integer price, String description) {

    public BookInfo {
        Objects.requireNonNull(isbn, "isbn must not be null");
        Objects.requireNonNull(title, "title must not be null");
        if (category == null) {
            category = BookCategory.BOOK;
        }
    }

    public static BookInfo of(String isbn, String title) {
        return new BookInfo(isbn, title, null, null, null, null, null, BookCategory.BOOK, null, null);
    }
}
