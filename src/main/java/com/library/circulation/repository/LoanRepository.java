package com.library.circulation.repository;

import com.library.circulation.model.Loan;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LoanRepository extends JpaRepository<Loan, Long> {

    /**
     * Member and book of a loan without loading the entity, so the rows can then be locked
     * in member, book, loan order.
     */
    @Query("SELECT l.memberId AS memberId, l.bookId AS bookId FROM Loan l WHERE l.id = :id")
    Optional<LoanParties> findPartiesById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT l FROM Loan l WHERE l.id = :id")
    Optional<Loan> findByIdForUpdate(@Param("id") Long id);

    Optional<Loan> findByRequestKey(String requestKey);

    long countByMemberIdAndStatusIn(Long memberId, Collection<Loan.LoanStatus> statuses);

    long countByBookIdAndStatusIn(Long bookId, Collection<Loan.LoanStatus> statuses);

    List<Loan> findByMemberIdAndStatusInOrderByDueDateAsc(Long memberId, Collection<Loan.LoanStatus> statuses);

    @Query("SELECT l FROM Loan l WHERE l.status IN :statuses AND l.returnedAt IS NULL AND l.dueDate < :now ORDER BY l.dueDate ASC")
    List<Loan> findOverdue(@Param("statuses") Collection<Loan.LoanStatus> statuses, @Param("now") LocalDateTime now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT l FROM Loan l WHERE l.status = :status AND l.returnedAt IS NULL AND l.dueDate < :now")
    List<Loan> findPastDueForUpdate(@Param("status") Loan.LoanStatus status, @Param("now") LocalDateTime now);
}
