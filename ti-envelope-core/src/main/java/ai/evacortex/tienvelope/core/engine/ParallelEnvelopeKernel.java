/*
 * TI Envelope — Regional Field Statistics Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.tienvelope.core.engine;

import ai.evacortex.tienvelope.core.field.MultipolarFieldSet;
import ai.evacortex.tienvelope.core.math.TiEnvelope;
import ai.evacortex.tienvelope.core.math.Vec3;

import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.function.IntConsumer;

/**
 * Splits the sample range into fork/join tasks. Each task writes a disjoint slice of the
 * output array, so no synchronization is needed.
 */
public final class ParallelEnvelopeKernel implements EnvelopeKernel {

    private static final int CFG_CHUNK = Math.max(256, Integer.getInteger("tienvelope.parallel.chunk", 4096));

    private final ForkJoinPool pool;
    private final int chunk;

    public ParallelEnvelopeKernel() {
        this(ForkJoinPool.commonPool(), CFG_CHUNK);
    }

    public ParallelEnvelopeKernel(ForkJoinPool pool, int chunk) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        if (chunk <= 0) throw new IllegalArgumentException("chunk must be > 0");
        this.chunk = chunk;
    }

    @Override
    public Vec3[] tiVectors(Vec3[] e1, Vec3[] e2) {
        JavaEnvelopeKernel.checkPair(e1, e2);
        Vec3[] out = new Vec3[e1.length];
        run(e1.length, i -> out[i] = TiEnvelope.tiVector(e1[i], e2[i]));
        return out;
    }

    @Override
    public double[] maxTiAmplitude(Vec3[] e1, Vec3[] e2) {
        JavaEnvelopeKernel.checkPair(e1, e2);
        double[] out = new double[e1.length];
        run(e1.length, i -> out[i] = TiEnvelope.maxTiAmplitude(e1[i], e2[i]));
        return out;
    }

    @Override
    public Vec3[] mtiVectors(MultipolarFieldSet fields) {
        Objects.requireNonNull(fields, "field set must not be null");
        Vec3[] a1 = fields.pairA().first(), a2 = fields.pairA().second();
        Vec3[] b1 = fields.pairB().first(), b2 = fields.pairB().second();
        Vec3[] out = new Vec3[fields.size()];
        run(out.length, i -> out[i] = TiEnvelope.tiVector(
                TiEnvelope.tiVector(a1[i], a2[i]),
                TiEnvelope.tiVector(b1[i], b2[i])));
        return out;
    }

    @Override
    public double[] mtiAmplitude(MultipolarFieldSet fields) {
        Objects.requireNonNull(fields, "field set must not be null");
        Vec3[] a1 = fields.pairA().first(), a2 = fields.pairA().second();
        Vec3[] b1 = fields.pairB().first(), b2 = fields.pairB().second();
        double[] out = new double[fields.size()];
        run(out.length, i -> out[i] = TiEnvelope.maxTiAmplitude(
                TiEnvelope.tiVector(a1[i], a2[i]),
                TiEnvelope.tiVector(b1[i], b2[i])));
        return out;
    }

    @Override
    public double[] directionalAmplitude(Vec3[] e1, Vec3[] e2, Vec3[] directions) {
        JavaEnvelopeKernel.checkPair(e1, e2);
        Objects.requireNonNull(directions, "directions must not be null");
        if (directions.length != e1.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + e1.length + " vs " + directions.length);
        }
        double[] out = new double[e1.length];
        run(e1.length, i -> out[i] = TiEnvelope.directionalAmplitude(e1[i], e2[i], directions[i]));
        return out;
    }

    private void run(int length, IntConsumer op) {
        if (length == 0) return;
        if (length <= chunk) {
            for (int i = 0; i < length; i++) op.accept(i);
            return;
        }
        pool.invoke(new RangeTask(0, length, chunk, op));
    }

    private static final class RangeTask extends RecursiveAction {
        private final int from;
        private final int to;
        private final int chunk;
        private final IntConsumer op;

        RangeTask(int from, int to, int chunk, IntConsumer op) {
            this.from = from;
            this.to = to;
            this.chunk = chunk;
            this.op = op;
        }

        @Override
        protected void compute() {
            if (to - from <= chunk) {
                for (int i = from; i < to; i++) op.accept(i);
                return;
            }
            int mid = (from + to) >>> 1;
            invokeAll(new RangeTask(from, mid, chunk, op), new RangeTask(mid, to, chunk, op));
        }
    }
}
