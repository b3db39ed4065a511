package com.keellang.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntConsumer;
import java.util.function.IntUnaryOperator;

/**
 * 可寻址位置：基局部变量 + 有序投影序列。
 * 读写 place 不会改变其所有权制式。
 */
public final class Place {

    private final int local;
    private final List<Projection> projections;

    private Place(int local, List<Projection> projections) {
        this.local = local;
        this.projections = projections;
    }

    public static Place local(int local) {
        return new Place(local, Collections.emptyList());
    }

    public int getLocal() { return local; }
    public List<Projection> getProjections() { return projections; }

    /** 是否为不带投影的裸局部变量 */
    public boolean isLocal() {
        return projections.isEmpty();
    }

    public boolean hasDeref() {
        for (Projection p : projections) {
            if (p instanceof Projection.Deref) return true;
        }
        return false;
    }

    /** 首个投影是否为解引用（*base...） */
    public boolean startsWithDeref() {
        return !projections.isEmpty() && projections.get(0) instanceof Projection.Deref;
    }

    public Place project(Projection projection) {
        List<Projection> list = new ArrayList<>(projections.size() + 1);
        list.addAll(projections);
        list.add(projection);
        return new Place(local, Collections.unmodifiableList(list));
    }

    public Place field(int index) {
        return project(Projection.field(index));
    }

    public Place deref() {
        return project(Projection.DEREF);
    }

    public Place index(int indexLocal) {
        return project(Projection.index(indexLocal));
    }

    public Place withLocal(int newLocal) {
        return newLocal == local ? this : new Place(newLocal, projections);
    }

    public Place remapLocals(IntUnaryOperator mapping) {
        int base = mapping.applyAsInt(local);
        List<Projection> mapped = null;
        for (int i = 0; i < projections.size(); i++) {
            Projection p = projections.get(i);
            Projection q = p.remapLocals(mapping);
            if (q != p && mapped == null) {
                mapped = new ArrayList<>(projections);
            }
            if (mapped != null) mapped.set(i, q);
        }
        if (base == local && mapped == null) return this;
        return new Place(base, mapped != null ? Collections.unmodifiableList(mapped) : projections);
    }

    /** 作为被读取的位置时涉及的局部变量：基变量 + 索引变量 */
    public void forEachReadLocal(IntConsumer consumer) {
        consumer.accept(local);
        forEachIndexLocal(consumer);
    }

    /**
     * 作为赋值目标时被读取的局部变量：索引变量，以及经由解引用写入时的基变量（句柄本身被读）。
     */
    public void forEachDestinationReadLocal(IntConsumer consumer) {
        if (hasDeref()) consumer.accept(local);
        forEachIndexLocal(consumer);
    }

    public void forEachIndexLocal(IntConsumer consumer) {
        for (Projection p : projections) {
            if (p instanceof Projection.Index) consumer.accept(((Projection.Index) p).getLocal());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Place)) return false;
        Place that = (Place) o;
        return local == that.local && projections.equals(that.projections);
    }

    @Override
    public int hashCode() {
        return local * 31 + projections.hashCode();
    }

    @Override
    public String toString() {
        String s = "_" + local;
        for (Projection p : projections) {
            if (p instanceof Projection.Deref) {
                s = "(*" + s + ")";
            } else {
                s = s + p;
            }
        }
        return s;
    }
}
