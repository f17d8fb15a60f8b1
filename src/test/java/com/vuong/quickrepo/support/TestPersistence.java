package com.vuong.quickrepo.support;

import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.cfg.AvailableSettings;
import org.hibernate.cfg.Configuration;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * In-memory H2 database with the test entities mapped, one database per instance.
 * Hands out sessions and remembers every session it opened.
 */
public class TestPersistence implements AutoCloseable {

    private final SessionFactory sessionFactory;
    private final List<Session> openedSessions = new CopyOnWriteArrayList<>();

    public TestPersistence() {
        this.sessionFactory = new Configuration()
                .addAnnotatedClass(Author.class)
                .addAnnotatedClass(Book.class)
                .setProperty(AvailableSettings.URL, "jdbc:h2:mem:quickrepo-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .setProperty(AvailableSettings.USER, "sa")
                .setProperty(AvailableSettings.PASS, "")
                .setProperty(AvailableSettings.HBM2DDL_AUTO, "create-drop")
                .buildSessionFactory();
    }

    public SessionFactory getSessionFactory() {
        return sessionFactory;
    }

    public Supplier<Session> sessions() {
        return () -> {
            Session session = sessionFactory.openSession();
            openedSessions.add(session);
            return session;
        };
    }

    public List<Session> getOpenedSessions() {
        return openedSessions;
    }

    public boolean hasOpenSessions() {
        return openedSessions.stream().anyMatch(Session::isOpen);
    }

    /**
     * Stores the given entities directly, bypassing the repositories under test.
     */
    public void store(Object... entities) {
        sessionFactory.inTransaction(session -> {
            for (Object entity : entities) {
                session.persist(entity);
            }
        });
    }

    @Override
    public void close() {
        sessionFactory.close();
    }
}
