package com.visitor.kiosk.repository;

import com.visitor.kiosk.entity.AdminUser;
import com.visitor.kiosk.entity.Host;
import com.visitor.kiosk.entity.VisitLog;
import com.visitor.kiosk.entity.Visitor;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class AdminListingRepositoryImpl implements AdminListingRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Visitor> findVisitors(int skip, int limit) {
        return page(entityManager.createQuery(
                "SELECT v FROM Visitor v ORDER BY v.id ASC", Visitor.class), skip, limit);
    }

    @Override
    public List<VisitLog> findVisitLogs(int skip, int limit) {
        String jpql = "SELECT l FROM VisitLog l " +
                "JOIN FETCH l.visitor " +
                "JOIN FETCH l.host " +
                "ORDER BY l.checkInTime DESC, l.id DESC";
        return page(entityManager.createQuery(jpql, VisitLog.class), skip, limit);
    }

    @Override
    public List<Host> findHosts(int skip, int limit) {
        return page(entityManager.createQuery(
                "SELECT h FROM Host h ORDER BY h.id ASC", Host.class), skip, limit);
    }

    @Override
    public List<AdminUser> findAdminUsers(int skip, int limit) {
        return page(entityManager.createQuery(
                "SELECT u FROM AdminUser u ORDER BY u.id ASC", AdminUser.class), skip, limit);
    }

    private static <T> List<T> page(TypedQuery<T> query, int skip, int limit) {
        query.setFirstResult(Math.max(0, skip));
        query.setMaxResults(Math.max(1, limit));
        return query.getResultList();
    }
}
