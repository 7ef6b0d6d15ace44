package com.tedu.juryportal.modules.admin;

import com.tedu.juryportal.modules.admin.dto.JurorStatusDto;
import com.tedu.juryportal.modules.auth.PinAuthService;
import com.tedu.juryportal.modules.credential.JurorAccount;
import com.tedu.juryportal.modules.credential.JurorAccountStore;
import com.tedu.juryportal.modules.unlock.ResetUnlockService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AdminService {

    private final JurorAccountStore accounts;
    private final PinAuthService pinAuthService;
    private final ResetUnlockService resetUnlockService;

    /** Never includes the PIN or the secret. */
    public JurorStatusDto getJurorStatus(String jurorId) {
        JurorAccount account = accounts.load(jurorId);
        int max = pinAuthService.getMaxAttempts();
        return JurorStatusDto.builder()
                .jurorId(jurorId)
                .name(account.getDisplayName())
                .dept(account.getDisplayDept())
                .pinSet(account.hasPin())
                .locked(account.isLocked())
                .failedAttempts(account.getFailedAttempts())
                .attemptsLeft(account.isLocked() ? 0 : Math.max(0, max - account.getFailedAttempts()))
                .resetUnlockAt(account.getResetUnlockAt())
                .resetWindowActive(resetUnlockService.isActive(jurorId))
                .build();
    }
}
