package com.surveyscore.backend.users.user.repo;

import com.surveyscore.backend.users.user.entity.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface UserAccountRepo extends JpaRepository<UserAccount, Long> {

    boolean existsByAccountName(String accountName);

    // setEmail 已經轉小寫，這裡再 IgnoreCase 一次，兩邊保險
    boolean existsByEmailIgnoreCase(String email);

    boolean existsByRegisterId(String registerId);

    List<UserAccount> findAllByOrderByIdAsc();
}
