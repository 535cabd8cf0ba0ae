package com.campus.reviews.service;

import com.campus.reviews.entity.TargetKind;
import com.campus.reviews.repository.CollegeRepository;
import com.campus.reviews.repository.ProfessorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ReviewTargetResolver {

    private final ProfessorRepository professorRepository;
    private final CollegeRepository collegeRepository;

    public boolean exists(TargetKind kind, UUID targetId) {
        if (kind == null || targetId == null) return false;
        return switch (kind) {
            case PROFESSOR -> professorRepository.existsById(targetId);
            case COLLEGE -> collegeRepository.existsById(targetId);
        };
    }
}
