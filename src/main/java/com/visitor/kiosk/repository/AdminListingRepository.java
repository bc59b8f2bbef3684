package com.visitor.kiosk.repository;

import com.visitor.kiosk.entity.AdminUser;
import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.entity.VisitLog;
import com.visitor.kiosk.entity.Visitor;

import java.util.List;

/**
 * Offset/limit listings for the admin dashboard. Spring Data pages are
 * page-number based, these take a raw row offset.
 */
public interface AdminListingRepository {

    List<Visitor> findVisitors(int skip, int limit);

    /**
     * Most recent check-in first, visitor and host fetched eagerly.
     */
    List<VisitLog> findVisitLogs(int skip, int limit);

    List<Host> findHosts(int skip, int limit);

    List<AdminUser> findAdminUsers(int skip, int limit);
}
