package com.visitor.kiosk.service;

import com.visitor.kiosk.dto.AdminUserDto;
import com.visitor.kiosk.dto.HostDto;
import com.visitor.kiosk.dto.VisitLogDto;
import com.visitor.kiosk.dto.VisitorDto;
import com.visitor.kiosk.repository.AdminListingRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Paginated read side of the admin dashboard.
 */
@Service
@Transactional(readOnly = true)
public class AdminQueryService {

    private final AdminListingRepository listingRepository;

    @Value("${kiosk.admin.max-page-size:100}")
    private int maxPageSize = 100;

    public AdminQueryService(AdminListingRepository listingRepository) {
        this.listingRepository = listingRepository;
    }

    public List<VisitorDto> listVisitors(int skip, int limit) {
        return listingRepository.findVisitors(skip, checkedLimit(skip, limit)).stream()
                .map(VisitorDto::from)
                .collect(Collectors.toList());
    }

    public List<VisitLogDto> listVisitLogs(int skip, int limit) {
        return listingRepository.findVisitLogs(skip, checkedLimit(skip, limit)).stream()
                .map(VisitLogDto::from)
                .collect(Collectors.toList());
    }

    public List<HostDto> listHosts(int skip, int limit) {
        return listingRepository.findHosts(skip, checkedLimit(skip, limit)).stream()
                .map(HostDto::from)
                .collect(Collectors.toList());
    }

    public List<AdminUserDto> listAdminUsers(int skip, int limit) {
        return listingRepository.findAdminUsers(skip, checkedLimit(skip, limit)).stream()
                .map(AdminUserDto::from)
                .collect(Collectors.toList());
    }

    /**
     * @throws IllegalArgumentException for a negative skip or a non-positive limit
     */
    private int checkedLimit(int skip, int limit) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be >= 0");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return Math.min(limit, maxPageSize);
    }
}
