package com.vuong.genericcrud.support;

import com.vuong.genericcrud.core.domain.repository.GenericRepository;

public interface TestGroupRepository extends GenericRepository<TestGroup, Long> {
}
