package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.config.CacheConfig;
import com.safeher.sosdispatch.entity.AppUser;
import com.safeher.sosdispatch.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Cached read access to user profiles.
 *
 * Kept in its own bean because @Cacheable works through the Spring proxy; a self-call from
 * inside the lifecycle service would skip the cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheableDataService {

    private final AppUserRepository appUserRepository;

    /**
     * Returns the user profile, cached per user id. Misses are not cached.
     */
    @Cacheable(value = CacheConfig.CACHE_USER_PROFILES, key = "#userId", unless = "#result == null")
    public Optional<AppUser> getUser(Long userId) {
        log.debug("[CACHE MISS] user #{} — loading from DB", userId);
        return appUserRepository.findById(userId);
    }
}
