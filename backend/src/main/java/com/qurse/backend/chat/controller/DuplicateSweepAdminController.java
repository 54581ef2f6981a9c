package com.qurse.backend.chat.controller;

import com.qurse.backend.chat.dedup.DuplicateSweepReport;
import com.qurse.backend.chat.dedup.DuplicateSweepService;
import com.qurse.backend.chat.identity.AdminAccessGuard;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/chat/duplicates")
public class DuplicateSweepAdminController {

  private final DuplicateSweepService sweepService;
  private final AdminAccessGuard adminAccessGuard;

  public DuplicateSweepAdminController(
      DuplicateSweepService sweepService, AdminAccessGuard adminAccessGuard) {
    this.sweepService = sweepService;
    this.adminAccessGuard = adminAccessGuard;
  }

  @PostMapping("/sweep")
  public DuplicateSweepReport sweep(HttpServletRequest request) {
    adminAccessGuard.ensureAdmin(request);
    return sweepService.sweep();
  }
}
