package com.flagship.bookkeeping.web;

import com.flagship.bookkeeping.setting.SettingsService;
import com.flagship.bookkeeping.web.dto.SettingsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping("/api/settings")
    public SettingsResponse getSettings() {
        return new SettingsResponse(settingsService.getUserName(), settingsService.getDomesticCurrency());
    }
}
