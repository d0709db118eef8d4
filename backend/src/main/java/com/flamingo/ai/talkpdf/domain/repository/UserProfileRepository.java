package com.flamingo.ai.talkpdf.domain.repository;

import com.flamingo.ai.talkpdf.domain.entity.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for UserProfile entities. */
@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, String> {}
