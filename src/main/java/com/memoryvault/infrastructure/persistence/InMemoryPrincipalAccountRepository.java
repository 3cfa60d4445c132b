package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.PrincipalAccount;
import com.memoryvault.domain.repository.PrincipalAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
public class InMemoryPrincipalAccountRepository implements PrincipalAccountRepository {

    private final Map<String, PrincipalAccount> accounts = new ConcurrentHashMap<>();

    @Override
    public Optional<PrincipalAccount> findById(String principalId) {
        return Optional.ofNullable(accounts.get(principalId));
    }

    @Override
    public void save(PrincipalAccount account) {
        accounts.put(account.getPrincipalId(), account);
        log.debug("Account persisted: principal={}, status={}", account.getPrincipalId(), account.getStatus());
    }

    @Override
    public boolean delete(String principalId) {
        boolean removed = accounts.remove(principalId) != null;
        if (removed) {
            log.warn("Account deleted: principal={}", principalId);
        }
        return removed;
    }
}
