package com.library.circulation.controller.dto;

import com.library.circulation.model.Book;

public record BookResponse(Long id, String title, int totalCopies, int availableCopies, int copiesOnLoan, boolean deleted) {

    public static BookResponse from(Book book) {
        return new BookResponse(book.getId(), book.getTitle(), book.getTotalCopies(),
                book.getAvailableCopies(), book.copiesOnLoan(), book.isDeleted());
    }
}
