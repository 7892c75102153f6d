/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.field;

import ai.evacortex.tienvelope.core.exceptions.InvalidFieldException;
import ai.evacortex.tienvelope.core.math.Vec3;

/**
 * Element geometry helpers for loaders that hand over raw tetrahedral meshes.
 */
public final class TetrahedralMesh {

    private TetrahedralMesh() {}

    /** {@code |det(v1 - v0, v2 - v0, v3 - v0)| / 6} */
    public static double volume(Vec3 v0, Vec3 v1, Vec3 v2, Vec3 v3) {
        Vec3 a = v1.subtract(v0);
        Vec3 b = v2.subtract(v0);
        Vec3 c = v3.subtract(v0);
        return Math.abs(a.dot(b.cross(c))) / 6.0;
    }

    public static Vec3 barycenter(Vec3 v0, Vec3 v1, Vec3 v2, Vec3 v3) {
        return v0.add(v1).add(v2).add(v3).scale(0.25);
    }

    /**
     * Builds the geometry of a mesh model from node coordinates and 0-based tetrahedron
     * connectivity. Positions are barycenters, weights are element volumes in mm³.
     */
    public static FieldSampleModel.Builder elements(Vec3[] nodes, int[][] tetrahedra, int[] tags) {
        if (tags != null && tags.length != tetrahedra.length) {
            throw new InvalidFieldException("tags has " + tags.length + " entries for " + tetrahedra.length + " elements");
        }
        Vec3[] centers = new Vec3[tetrahedra.length];
        double[] volumes = new double[tetrahedra.length];
        for (int e = 0; e < tetrahedra.length; e++) {
            int[] tet = tetrahedra[e];
            if (tet.length != 4) {
                throw new InvalidFieldException("element " + e + " has " + tet.length + " nodes, expected 4");
            }
            Vec3 v0 = node(nodes, tet[0], e);
            Vec3 v1 = node(nodes, tet[1], e);
            Vec3 v2 = node(nodes, tet[2], e);
            Vec3 v3 = node(nodes, tet[3], e);
            centers[e] = barycenter(v0, v1, v2, v3);
            volumes[e] = volume(v0, v1, v2, v3);
        }
        return FieldSampleModel.builder(FieldKind.MESH)
                .positions(centers)
                .weights(volumes)
                .regionTags(tags != null ? tags : new int[tetrahedra.length]);
    }

    private static Vec3 node(Vec3[] nodes, int index, int element) {
        if (index < 0 || index >= nodes.length) {
            throw new InvalidFieldException("element " + element + " references node " + index
                    + " outside [0, " + nodes.length + ")");
        }
        return nodes[index];
    }
}
