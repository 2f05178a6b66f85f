package com.residencepark.visitorparking.service;

import com.residencepark.visitorparking.config.CacheConfig;
import com.residencepark.visitorparking.repository.VisitorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cached directory of the unit numbers that currently have visitor records.
 *
 * Kept as its own bean because @Cacheable works through a Spring proxy:
 * calls from inside VisitorService to its own methods would bypass the cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UnitDirectoryService {

    private final VisitorRepository visitorRepository;

    /** Sorted unit numbers; the cached list is unmodifiable and shared by all callers. */
    @Cacheable(value = CacheConfig.CACHE_UNIT_NUMBERS, key = "'all'")
    public List<String> getUnitNumbers() {
        log.debug("[CACHE MISS] unitNumbers — loading from DB");
        return List.copyOf(visitorRepository.findDistinctUnitNumbers());
    }

    /** Called after every register and delete. */
    @CacheEvict(value = CacheConfig.CACHE_UNIT_NUMBERS, allEntries = true)
    public void evictUnitNumbers() {
        log.debug("[CACHE EVICT] unitNumbers cleared");
    }
}
