package com.fintech.escrow.repository;

import com.fintech.escrow.entity.ReconcilerCursor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReconcilerCursorRepository extends JpaRepository<ReconcilerCursor, String> {
}
