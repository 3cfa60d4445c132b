package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.PrincipalAccount;

import java.util.Optional;

public interface PrincipalAccountRepository {

    Optional<PrincipalAccount> findById(String principalId);

    void save(PrincipalAccount account);

    boolean delete(String principalId);
}
