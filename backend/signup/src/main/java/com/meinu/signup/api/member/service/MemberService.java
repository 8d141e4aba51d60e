package com.meinu.signup.api.member.service;

import com.meinu.signup.api.auth.usecase.AccountCreator;
import com.meinu.signup.api.auth.usecase.AccountInput;
import com.meinu.signup.api.auth.usecase.AccountRecord;
import com.meinu.signup.api.member.entity.Member;
import com.meinu.signup.api.member.repository.MemberRepository;
import com.meinu.signup.global.common.base.BaseException;
import com.meinu.signup.global.common.base.BaseResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;

@Service
@Transactional
public class MemberService implements AccountCreator {
    private static final Logger log = LoggerFactory.getLogger(MemberService.class);
    // BCrypt ignores everything past 72 bytes
    private static final int MAX_PASSWORD_BYTES = 72;

    private final MemberRepository memberRepository;
    private final PasswordEncoder passwordEncoder;

    public MemberService(MemberRepository memberRepository, PasswordEncoder passwordEncoder) {
        this.memberRepository = memberRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public AccountRecord add(AccountInput input) {
        if (input.password().getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES)
            throw new BaseException(BaseResponseStatus.PASSWORD_TOO_LONG);
        if (memberRepository.existsByEmail(input.email()))
            throw new BaseException(BaseResponseStatus.EMAIL_ALREADY_EXISTS);
        String hash = passwordEncoder.encode(input.password());
        Member m = Member.builder()
                .email(input.email())
                .name(input.name())
                .passwordHash(hash)
                .build();
        Member saved = memberRepository.save(m);
        if (log.isInfoEnabled()) {
            log.info("Member created: memberId={} email={}", saved.getId(), saved.getEmail());
        }
        return toRecord(saved);
    }

    private AccountRecord toRecord(Member m) {
        return new AccountRecord(m.getId(), m.getName(), m.getEmail());
    }
}
