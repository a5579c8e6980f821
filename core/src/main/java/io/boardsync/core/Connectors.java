// file: core/src/main/java/io/boardsync/core/Connectors.java
package io.boardsync.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Geometry of connectors (arrows, lines) whose ends are attached to shapes.
 * <p>
 * An attached end is stored in the connector's properties as the shape id plus the
 * anchor side it snapped to. When the shape moves, the end follows that anchor; if
 * the side is unknown it falls back to the shape's anchor closest to the other end.
 * The connector is then re-laid out as starting at the start point, with
 * {@code width/height} and {@code points = [0, 0, dx, dy]} spanning to the end point.
 * All functions are pure.
 */
public final class Connectors {

    public static final String START_ID = "startObjectId";
    public static final String END_ID = "endObjectId";
    public static final String START_SIDE = "startAnchorSide";
    public static final String END_SIDE = "endAnchorSide";
    public static final String POINTS = "points";

    private static final double HALF_SQRT2 = Math.sqrt(0.5);

    /** A snap point on a shape's outline. */
    public record Anchor(double x, double y, String side) {}

    private Connectors() {
    }

    /**
     * Anchors of a shape: 8 around the ellipse for circles, otherwise the 4 corners
     * plus quarter points along each edge. Rotation turns them around the point the
     * shape rotates about (center for circles, top-left otherwise).
     */
    public static List<Anchor> anchors(WhiteboardObject o) {
        double x = o.x(), y = o.y(), w = o.width(), h = o.height();
        List<Anchor> out = new ArrayList<>(16);
        if (o.type() == ObjectType.CIRCLE) {
            double cx = x + w / 2, cy = y + h / 2, rx = w / 2, ry = h / 2;
            out.add(new Anchor(cx, cy - ry, "top"));
            out.add(new Anchor(cx + rx * HALF_SQRT2, cy - ry * HALF_SQRT2, "top-right"));
            out.add(new Anchor(cx + rx, cy, "right"));
            out.add(new Anchor(cx + rx * HALF_SQRT2, cy + ry * HALF_SQRT2, "bottom-right"));
            out.add(new Anchor(cx, cy + ry, "bottom"));
            out.add(new Anchor(cx - rx * HALF_SQRT2, cy + ry * HALF_SQRT2, "bottom-left"));
            out.add(new Anchor(cx - rx, cy, "left"));
            out.add(new Anchor(cx - rx * HALF_SQRT2, cy - ry * HALF_SQRT2, "top-left"));
        } else {
            out.add(new Anchor(x, y, "top-left"));
            out.add(new Anchor(x + w, y, "top-right"));
            out.add(new Anchor(x + w, y + h, "bottom-right"));
            out.add(new Anchor(x, y + h, "bottom-left"));
            for (int q = 25; q <= 75; q += 25) {
                double f = q / 100.0;
                out.add(new Anchor(x + w * f, y, "top-" + q));
                out.add(new Anchor(x + w, y + h * f, "right-" + q));
                out.add(new Anchor(x + w * f, y + h, "bottom-" + q));
                out.add(new Anchor(x, y + h * f, "left-" + q));
            }
        }
        if (o.rotation() == 0) return out;

        double px = o.type() == ObjectType.CIRCLE ? x + w / 2 : x;
        double py = o.type() == ObjectType.CIRCLE ? y + h / 2 : y;
        double rad = Math.toRadians(o.rotation());
        double cos = Math.cos(rad), sin = Math.sin(rad);
        List<Anchor> rotated = new ArrayList<>(out.size());
        for (Anchor a : out) {
            double dx = a.x() - px, dy = a.y() - py;
            rotated.add(new Anchor(px + dx * cos - dy * sin, py + dx * sin + dy * cos, a.side()));
        }
        return rotated;
    }

    public static Optional<Anchor> anchorBySide(WhiteboardObject o, String side) {
        for (Anchor a : anchors(o)) {
            if (a.side().equals(side)) return Optional.of(a);
        }
        return Optional.empty();
    }

    public static Anchor closestAnchor(WhiteboardObject o, double px, double py) {
        Anchor best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (Anchor a : anchors(o)) {
            double d = (a.x() - px) * (a.x() - px) + (a.y() - py) * (a.y() - py);
            if (d < bestDist) {
                bestDist = d;
                best = a;
            }
        }
        return best;
    }

    /** Connectors with at least one end attached to {@code shapeId}. */
    public static List<WhiteboardObject> attachedTo(Map<String, WhiteboardObject> objects, String shapeId) {
        List<WhiteboardObject> out = new ArrayList<>();
        for (WhiteboardObject o : objects.values()) {
            if (!o.type().isConnector()) continue;
            if (shapeId.equals(o.property(START_ID)) || shapeId.equals(o.property(END_ID))) {
                out.add(o);
            }
        }
        return out;
    }

    /**
     * Unstamped patch moving {@code connector}'s attached ends onto their shapes in
     * {@code objects}; empty when neither end is attached or nothing would change.
     */
    public static Optional<ObjectPatch> layout(WhiteboardObject connector, Map<String, WhiteboardObject> objects) {
        Object startId = connector.property(START_ID);
        Object endId = connector.property(END_ID);
        if (startId == null && endId == null) return Optional.empty();

        double[] pts = points(connector);
        WhiteboardObject start = startId != null ? objects.get(startId.toString()) : null;
        WhiteboardObject end = endId != null ? objects.get(endId.toString()) : null;

        double sx, sy, ex, ey;
        if (start != null) {
            double refX = end != null ? end.x() + end.width() / 2 : connector.x() + pts[2];
            double refY = end != null ? end.y() + end.height() / 2 : connector.y() + pts[3];
            Anchor a = anchorOf(start, connector.property(START_SIDE), refX, refY);
            sx = a.x();
            sy = a.y();
        } else {
            sx = connector.x() + pts[0];
            sy = connector.y() + pts[1];
        }
        if (end != null) {
            double refX = start != null ? start.x() + start.width() / 2 : connector.x() + pts[0];
            double refY = start != null ? start.y() + start.height() / 2 : connector.y() + pts[1];
            Anchor a = anchorOf(end, connector.property(END_SIDE), refX, refY);
            ex = a.x();
            ey = a.y();
        } else {
            ex = connector.x() + pts[2];
            ey = connector.y() + pts[3];
        }

        double dx = ex - sx, dy = ey - sy;
        ObjectPatch patch = ObjectPatch.builder()
                .x(sx).y(sy).width(dx).height(dy)
                .property(POINTS, List.of(0.0, 0.0, dx, dy))
                .build();
        return connector.apply(patch) == connector ? Optional.empty() : Optional.of(patch);
    }

    /**
     * Layout patches for every connector attached to one of {@code movedIds}.
     * Connectors that are themselves in {@code movedIds} are left alone.
     */
    public static List<ObjectUpdate> follow(Map<String, WhiteboardObject> objects, Collection<String> movedIds) {
        Set<String> seen = new LinkedHashSet<>(movedIds);
        List<ObjectUpdate> out = new ArrayList<>();
        for (String id : movedIds) {
            WhiteboardObject moved = objects.get(id);
            if (moved == null || moved.type().isConnector()) continue;
            for (WhiteboardObject c : attachedTo(objects, id)) {
                if (!seen.add(c.id())) continue;
                layout(c, objects).ifPresent(p -> out.add(new ObjectUpdate(c.id(), p)));
            }
        }
        return out;
    }

    private static Anchor anchorOf(WhiteboardObject shape, Object side, double refX, double refY) {
        if (side != null) {
            Optional<Anchor> a = anchorBySide(shape, side.toString());
            if (a.isPresent()) return a.get();
        }
        return closestAnchor(shape, refX, refY);
    }

    /** Stored {@code points}, or a straight span over the bounding box. */
    private static double[] points(WhiteboardObject connector) {
        Object raw = connector.property(POINTS);
        if (raw instanceof List<?>) {
            List<?> list = (List<?>) raw;
            if (list.size() >= 4 && list.stream().allMatch(Number.class::isInstance)) {
                double[] out = new double[4];
                for (int i = 0; i < 4; i++) out[i] = ((Number) list.get(i)).doubleValue();
                return out;
            }
        }
        return new double[] {0, 0, connector.width(), connector.height()};
    }
}
