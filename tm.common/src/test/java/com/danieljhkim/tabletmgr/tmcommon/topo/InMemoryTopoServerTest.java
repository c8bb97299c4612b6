package com.danieljhkim.tabletmgr.tmcommon.topo;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.danieljhkim.tabletmgr.tmcommon.exception.TopoNodeExistsException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoNotFoundException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoValidationException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoVersionMismatchException;

class InMemoryTopoServerTest {

    private static final TabletAlias ALIAS = new TabletAlias("cell1", 100);

    private InMemoryTopoServer topo;

    @BeforeEach
    void setUp() {
        topo = new InMemoryTopoServer();
        topo.createTablet(Tablet.create(ALIAS, "ks", "0", TabletType.REPLICA));
    }

    @Test
    void createTablet_startsAtVersionOneAndRejectsDuplicates() {
        assertEquals(1, topo.getTablet(ALIAS).version());
        assertThrows(TopoNodeExistsException.class,
                () -> topo.createTablet(Tablet.create(ALIAS, "ks", "0", TabletType.REPLICA)));
    }

    @Test
    void getTablet_unknownAlias_throwsNotFound() {
        TopoNotFoundException e = assertThrows(TopoNotFoundException.class,
                () -> topo.getTablet(new TabletAlias("cell1", 999)));
        assertEquals("cell1-0000000999", e.getTabletAlias());
    }

    @Test
    void updateTabletFields_bumpsVersionAndKeepsOtherFields() {
        topo.updateTabletFields(ALIAS, t -> t.withTag("owner", "ops"));
        TabletInfo updated = topo.updateTabletFields(ALIAS, t -> t.withHostname("host-a"));

        assertEquals(3, updated.version());
        assertEquals("ops", updated.tablet().tags().get("owner"));
        assertEquals("host-a", topo.getTablet(ALIAS).tablet().hostname());
    }

    @Test
    void updateTablet_staleVersion_isRejected() {
        TabletInfo read = topo.getTablet(ALIAS);
        topo.updateTabletFields(ALIAS, t -> t.withType(TabletType.RDONLY));

        assertThrows(TopoVersionMismatchException.class,
                () -> topo.updateTablet(read.withTablet(read.tablet().withHostname("x"))));
        assertEquals(TabletType.RDONLY, topo.getTablet(ALIAS).type());
    }

    @Test
    void updateTablet_currentVersion_returnsNextVersion() {
        TabletInfo read = topo.getTablet(ALIAS);

        long version = topo.updateTablet(read.withTablet(read.tablet().withHostname("host-a")));

        assertEquals(read.version() + 1, version);
        assertEquals("host-a", topo.getTablet(ALIAS).tablet().hostname());
    }

    @Test
    void concurrentFieldUpdates_areAllApplied() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < writers; i++) {
                String key = "k" + i;
                pool.execute(() -> {
                    try {
                        start.await();
                        topo.updateTabletFields(ALIAS, t -> t.withTag(key, "v"));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }

        TabletInfo info = topo.getTablet(ALIAS);
        assertEquals(writers, info.tablet().tags().size());
        assertEquals(1 + writers, info.version());
    }

    @Test
    void validateTablet_requiresKeyspaceForServingTypes() {
        topo.validateTablet(ALIAS);

        topo.updateTabletFields(ALIAS, t -> new Tablet(t.alias(), t.hostname(), t.ipAddr(), t.portMap(), "", "",
                TabletType.REPLICA, t.tags()));
        assertThrows(TopoValidationException.class, () -> topo.validateTablet(ALIAS));

        topo.updateTabletFields(ALIAS, t -> t.withType(TabletType.IDLE));
        topo.validateTablet(ALIAS);
    }

    @Test
    void endpoints_areKeyedByUid() {
        EndPoint first = new EndPoint(100, "host-a", null);
        EndPoint moved = new EndPoint(100, "host-b", null);
        topo.updateTabletEndpoint("cell1", "ks", "0", TabletType.REPLICA, first);
        topo.updateTabletEndpoint("cell1", "ks", "0", TabletType.REPLICA, moved);

        assertEquals(List.of(moved), topo.getEndPoints("cell1", "ks", "0", TabletType.REPLICA));
        assertTrue(topo.getEndPoints("cell1", "ks", "0", TabletType.MASTER).isEmpty());
    }

    @Test
    void deleteTabletEndpoint_removesOnlyThatUid() {
        topo.updateTabletEndpoint("cell1", "ks", "0", TabletType.REPLICA, new EndPoint(100, "host-a", null));
        topo.updateTabletEndpoint("cell1", "ks", "0", TabletType.REPLICA, new EndPoint(101, "host-b", null));

        topo.deleteTabletEndpoint("cell1", "ks", "0", TabletType.REPLICA, 100);
        topo.deleteTabletEndpoint("cell1", "ks", "0", TabletType.REPLICA, 100);
        topo.deleteTabletEndpoint("cell2", "ks", "0", TabletType.MASTER, 100);

        List<EndPoint> left = topo.getEndPoints("cell1", "ks", "0", TabletType.REPLICA);
        assertEquals(1, left.size());
        assertEquals("host-b", left.get(0).host());
    }

    @Test
    void tabletControl_setAndClear() {
        TabletControl control = new TabletControl(Set.of("t1"), true);
        topo.setTabletControl("cell1", "ks", "0", TabletType.REPLICA, control);

        assertEquals(control, topo.getTabletControl("cell1", "ks", "0", TabletType.REPLICA).orElseThrow());

        topo.setTabletControl("cell1", "ks", "0", TabletType.REPLICA, null);
        assertTrue(topo.getTabletControl("cell1", "ks", "0", TabletType.REPLICA).isEmpty());
    }
}
