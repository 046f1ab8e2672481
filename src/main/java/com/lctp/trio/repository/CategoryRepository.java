package com.lctp.trio.repository;

import com.lctp.trio.entity.Category;
import com.lctp.trio.enums.CategoryType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CategoryRepository extends JpaRepository<Category, Long> {

    List<Category> findByTypeAndActiveTrue(CategoryType type);
}
