package com.danieljhkim.tabletmgr.tmagent.converter;

import java.util.Map;

import com.danieljhkim.tabletmgr.tmagent.health.HealthStreamReply;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletType;

/**
 * Converts between the agent's records and the generated tablet manager protos.
 */
public final class ProtoConverter {

	private ProtoConverter() {
		// Utility class
	}

	// ============================
	// Tablet Conversions
	// ============================

	public static com.danieljhkim.tabletmgr.proto.tabletmanager.Tablet toProto(Tablet tablet) {
		if (tablet == null) {
			return com.danieljhkim.tabletmgr.proto.tabletmanager.Tablet.getDefaultInstance();
		}
		var builder = com.danieljhkim.tabletmgr.proto.tabletmanager.Tablet.newBuilder()
				.setHostname(tablet.hostname())
				.setIpAddr(tablet.ipAddr())
				.putAllPortMap(tablet.portMap())
				.setKeyspace(tablet.keyspace())
				.setShard(tablet.shard())
				.setType(toProto(tablet.type()))
				.putAllTags(tablet.tags());
		if (tablet.alias() != null) {
			builder.setAlias(toProto(tablet.alias()));
		}
		return builder.build();
	}

	public static Tablet fromProto(com.danieljhkim.tabletmgr.proto.tabletmanager.Tablet proto) {
		TabletAlias alias = proto.hasAlias() ? fromProto(proto.getAlias()) : null;
		Map<String, Integer> ports = proto.getPortMapMap();
		return new Tablet(
				alias,
				proto.getHostname(),
				proto.getIpAddr(),
				ports,
				proto.getKeyspace(),
				proto.getShard(),
				fromProto(proto.getType()),
				proto.getTagsMap());
	}

	public static com.danieljhkim.tabletmgr.proto.tabletmanager.TabletAlias toProto(TabletAlias alias) {
		return com.danieljhkim.tabletmgr.proto.tabletmanager.TabletAlias.newBuilder()
				.setCell(alias.cell())
				.setUid(alias.uid())
				.build();
	}

	public static TabletAlias fromProto(com.danieljhkim.tabletmgr.proto.tabletmanager.TabletAlias proto) {
		return new TabletAlias(proto.getCell(), proto.getUid());
	}

	// ============================
	// TabletType Conversions
	// ============================

	public static com.danieljhkim.tabletmgr.proto.tabletmanager.TabletType toProto(TabletType type) {
		if (type == null) {
			return com.danieljhkim.tabletmgr.proto.tabletmanager.TabletType.UNKNOWN;
		}
		return com.danieljhkim.tabletmgr.proto.tabletmanager.TabletType.valueOf(type.name());
	}

	public static TabletType fromProto(com.danieljhkim.tabletmgr.proto.tabletmanager.TabletType type) {
		if (type == null || type == com.danieljhkim.tabletmgr.proto.tabletmanager.TabletType.UNRECOGNIZED) {
			return TabletType.UNKNOWN;
		}
		return TabletType.valueOf(type.name());
	}

	// ============================
	// Health Conversions
	// ============================

	public static com.danieljhkim.tabletmgr.proto.tabletmanager.HealthStreamReply toProto(HealthStreamReply reply) {
		return com.danieljhkim.tabletmgr.proto.tabletmanager.HealthStreamReply.newBuilder()
				.setTablet(toProto(reply.tablet()))
				.setReplicationDelayMs(reply.replicationDelay().toMillis())
				.setHealthError(reply.healthError())
				.setTimestampMs(reply.timestamp().toEpochMilli())
				.build();
	}
}
