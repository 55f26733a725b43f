package com.library.circulation.model;

import com.library.circulation.error.exception.CopiesOnLoanException;
import com.library.circulation.error.exception.InvalidInputException;
import com.library.circulation.error.exception.InventoryInvariantException;
import com.library.circulation.error.exception.OutOfStockException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Inventory ledger for one title. {@code 0 <= availableCopies <= totalCopies} holds after
 * every mutation; a mutation that would break it fails instead of being clamped.
 *
 * <p>{@link #copiesOnLoan()} must match the number of this book's loans that are still on
 * loan. Only the circulation service keeps the two in step, inside one transaction.
 */
@Entity
@Table(name = "books")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@ToString
public class Book {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false)
    private int totalCopies;

    @Column(nullable = false)
    private int availableCopies;

    @Column(nullable = false)
    private boolean deleted;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Book(String title, int totalCopies, LocalDateTime now) {
        if (title == null || title.isBlank()) {
            throw new InvalidInputException("title must not be blank");
        }
        if (totalCopies < 0) {
            throw new InvalidInputException("total copies cannot be negative");
        }
        this.title = title.trim();
        this.totalCopies = totalCopies;
        this.availableCopies = totalCopies;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public int copiesOnLoan() {
        return totalCopies - availableCopies;
    }

    public boolean isAvailable() {
        return availableCopies > 0 && !deleted;
    }

    public void reserveCopy(LocalDateTime now) {
        if (availableCopies == 0) {
            throw new OutOfStockException(label());
        }
        availableCopies--;
        touch(now);
    }

    public void releaseCopy(LocalDateTime now) {
        if (availableCopies >= totalCopies) {
            throw new InventoryInvariantException(id, "release would exceed total copies (" + totalCopies + ")");
        }
        availableCopies++;
        touch(now);
    }

    public void addCopies(int count, LocalDateTime now) {
        if (count <= 0) {
            throw new InvalidInputException("copies to add must be positive, was " + count);
        }
        totalCopies += count;
        availableCopies += count;
        touch(now);
    }

    /**
     * Removes a copy that is out on loan and will never come back.
     */
    public void writeOffCopy(LocalDateTime now) {
        if (copiesOnLoan() == 0) {
            throw new InventoryInvariantException(id, "no copy is on loan to write off");
        }
        totalCopies--;
        touch(now);
    }

    public void markDeleted(long copiesOutstanding, LocalDateTime now) {
        if (copiesOutstanding > 0) {
            throw new CopiesOnLoanException(id, copiesOutstanding);
        }
        deleted = true;
        updatedAt = now;
    }

    private void touch(LocalDateTime now) {
        if (availableCopies < 0 || availableCopies > totalCopies) {
            throw new InventoryInvariantException(id,
                    "available=" + availableCopies + ", total=" + totalCopies);
        }
        updatedAt = now;
    }

    private String label() {
        return "'" + title + "' (id: " + id + ")";
    }
}
