package com.nayem.hydrator.core;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Object graphs used across the engine tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static class Customer {
        public long id;

        public Customer() {
        }

        public Customer(long id) {
            this.id = id;
        }
    }

    public static class Address {
        public String city;

        public Address(String city) {
            this.city = city;
        }
    }

    /**
     * Finder directive on a public field, fed from a private property with a
     * getter.
     */
    public static class Order {
        public long id;

        @Hydrate("customerId")
        public Customer customer;

        private long customerId;

        public Order(long id, long customerId) {
            this.id = id;
            this.customerId = customerId;
        }

        public long getCustomerId() {
            return customerId;
        }
    }

    public static class Detail {
        public int value;

        public Detail(int value) {
            this.value = value;
        }
    }

    /**
     * Method directives producing a nested object and a list of nested
     * objects.
     */
    public static class Shipment {
        @Hydrate("loadDetail")
        public Detail detail;

        @Hydrate("loadDetails")
        public List<Detail> details;

        public Object loadDetail(Object self) {
            return new Detail(4);
        }

        public Object loadDetails(Object self) {
            return List.of(new Detail(5), new Detail(6));
        }
    }

    /**
     * Private fields written through setters; the directive method resolves to
     * a {@link Shipment} that is itself hydrated.
     */
    public static class Invoice {
        private Customer customer;
        private long customerId;

        @Hydrate("customerId")
        private Customer billedTo;

        @Hydrate("loadShipment")
        private Shipment shipment;

        public Invoice(long customerId) {
            this.customerId = customerId;
        }

        public long getCustomerId() {
            return customerId;
        }

        public Customer getBilledTo() {
            return billedTo;
        }

        public void setBilledTo(Customer billedTo) {
            this.billedTo = billedTo;
        }

        public Shipment getShipment() {
            return shipment;
        }

        public void setShipment(Shipment shipment) {
            this.shipment = shipment;
        }

        public Customer getCustomer() {
            return customer;
        }

        public Object loadShipment(Object self) {
            return new Shipment();
        }
    }

    /**
     * A settable field whose setter refuses every value.
     */
    public static class RejectingSetter {
        @Hydrate("loadDetail")
        private Detail detail;

        public Detail getDetail() {
            return detail;
        }

        public void setDetail(Detail detail) {
            throw new IllegalArgumentException("detail is read-only");
        }

        public Object loadDetail(Object self) {
            return new Detail(1);
        }
    }

    /**
     * Both a method named by the directive and a possible finder for the
     * element type exist; the method must win.
     */
    public static class MethodFirst {
        public long customer = 7;

        @Hydrate("customer")
        public Customer resolved;

        public Object customer(Object self) {
            return new Customer(99);
        }
    }

    /**
     * Directive values that hydrate nothing.
     */
    public static class Disabled {
        @Hydrate("")
        public Customer empty;

        @Hydrate("-")
        public Customer dash;

        public int primitive;
    }

    /**
     * Values that are not application objects.
     */
    public static class Scalars {
        @Hydrate("loadNumber")
        public Integer number;

        @Hydrate("loadNumbers")
        public List<Integer> numbers;

        @Hydrate("loadArray")
        public Integer[] array;

        @Hydrate("loadPrimitives")
        public int[] primitives;

        public Object loadNumber(Object self) {
            return 123;
        }

        public Object loadNumbers(Object self) {
            return List.of(1, 2);
        }

        public Object loadArray(Object self) {
            return new Integer[] { 3, 4 };
        }

        public Object loadPrimitives(Object self) {
            return new int[] { 5, 6 };
        }
    }

    public static class Failing {
        @Hydrate("loadDetail")
        public Detail detail;

        public Object loadDetail(Object self) throws Exception {
            throw new IllegalStateException("boom");
        }
    }

    /**
     * The method both returns a value and fails; the value must be discarded.
     */
    public static class ValueAndError {
        @Hydrate("getError")
        public Detail detail;

        public Object getError(Object self) throws Exception {
            Detail produced = new Detail(1);
            if (produced.value > 0) {
                throw new Exception("Hydration error");
            }
            return produced;
        }
    }

    public static class TwoFailures {
        @Hydrate("first")
        public Detail first;

        @Hydrate("second")
        public Detail second;

        @Hydrate("third")
        public Detail third;

        public Object first(Object self) {
            throw new IllegalArgumentException("first failed");
        }

        public Object second(Object self) {
            throw new IllegalArgumentException("second failed");
        }

        public Object third(Object self) {
            return new Detail(3);
        }
    }

    public static class Mismatched {
        @Hydrate("asList")
        public Detail single;

        @Hydrate("asObject")
        public List<Detail> many;

        @Hydrate("asArray")
        public List<Detail> listFromArray;

        @Hydrate("wrongType")
        public Detail wrongType;

        @Hydrate("fine")
        public Detail fine;

        public Object asList(Object self) {
            return List.of(new Detail(1));
        }

        public Object asObject(Object self) {
            return new Detail(2);
        }

        public Object asArray(Object self) {
            return new Detail[] { new Detail(3) };
        }

        public Object wrongType(Object self) {
            return new Customer(1);
        }

        public Object fine(Object self) {
            return new Detail(5);
        }
    }

    public static class Child {
        public final int id;
        public final boolean broken;

        @Hydrate("loadDetail")
        public Detail detail;

        public Child(int id, boolean broken) {
            this.id = id;
            this.broken = broken;
        }

        public Object loadDetail(Object self) {
            if (broken) {
                throw new IllegalStateException("child " + id + " is broken");
            }
            return new Detail(id * 10);
        }
    }

    public static class Parent {
        @Hydrate("loadChildren")
        public List<Child> children;

        @Hydrate("loadChildArray")
        public Child[] childArray;

        public Object loadChildren(Object self) {
            return List.of(new Child(1, false), new Child(2, true), new Child(3, false));
        }

        public Object loadChildArray(Object self) {
            return new Child[] { new Child(4, false), null };
        }
    }

    public static class NestedFailure {
        @Hydrate("loadFailing")
        public Failing failing;

        public Object loadFailing(Object self) {
            return new Failing();
        }
    }

    public static class StaticDirective {
        @Hydrate("loadDetail")
        public static Detail shared;

        @Hydrate("loadOther")
        public Detail other;

        public final AtomicInteger calls = new AtomicInteger();

        public Object loadDetail(Object self) {
            calls.incrementAndGet();
            return new Detail(1);
        }

        public Object loadOther(Object self) {
            calls.incrementAndGet();
            return new Detail(2);
        }
    }

    public static class PrimitiveDirective {
        @Hydrate("loadOther")
        public Detail other;

        @Hydrate("loadCount")
        public int count;

        public final AtomicInteger calls = new AtomicInteger();

        public Object loadOther(Object self) {
            calls.incrementAndGet();
            return new Detail(2);
        }

        public Object loadCount(Object self) {
            calls.incrementAndGet();
            return 3;
        }
    }

    public static class MapDirective {
        @Hydrate("loadIndex")
        public Map<String, Detail> index;

        public Object loadIndex(Object self) {
            return Map.of();
        }
    }

    /**
     * A private field without setter; a resolver is available for it.
     */
    public static class PrivateDirective {
        public long customerId = 1;

        @Hydrate("customerId")
        private Customer customer;

        public Customer customer() {
            return customer;
        }
    }

    public static class FinalDirective {
        public long customerId = 1;

        @Hydrate("customerId")
        public final Customer customer = null;
    }

    /**
     * A method with the directive's name but not the directive signature.
     */
    public static class WrongSignature {
        public long lookup = 1;

        @Hydrate("lookup")
        public Customer customer;

        public Customer lookup() {
            return new Customer(1);
        }

        public Customer lookup(String key, int extra) {
            return new Customer(2);
        }
    }

    public static class MissingSource {
        @Hydrate("noSuchProperty")
        public Customer customer;
    }

    public static class ContextAware {
        public HydrationContext seen;

        @Hydrate("loadDetail")
        public Detail detail;

        public Object loadDetail(HydrationContext context, Object self) {
            seen = context;
            return new Detail(8);
        }
    }

    public static class TypedInput {
        @Hydrate("loadDetail")
        public Detail detail;

        public Detail loadDetail(TypedInput self) {
            return new Detail(self == this ? 1 : 0);
        }
    }

    public static class BaseEntity {
        public long customerId = 5;

        @Hydrate("customerId")
        public Customer owner;
    }

    public static class DerivedEntity extends BaseEntity {
        @Hydrate("loadDetail")
        public Detail detail;

        public Object loadDetail(Object self) {
            return new Detail(11);
        }
    }

    public static class ListFinder {
        public List<Long> customerIds = List.of(1L, 2L);

        @Hydrate("customerIds")
        public List<Customer> customers;

        public long firstId = 9;

        @Hydrate("firstId")
        public Customer[] customerArray;
    }

    public static class Preset {
        public long customerId = 3;

        @Hydrate("customerId")
        public Customer customer = new Customer(-1);
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Lookup {
        String value();
    }

    @Retention(RetentionPolicy.CLASS)
    @Target(ElementType.FIELD)
    public @interface CompileTimeOnly {
        String value();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface NoValue {
    }

    public static class Tagged {
        @Lookup("loadDetail")
        public Detail detail;

        @Hydrate("loadOther")
        public Detail other;

        public Object loadDetail(Object self) {
            return new Detail(3);
        }

        public Object loadOther(Object self) {
            return new Detail(4);
        }
    }

    public enum Color {
        RED
    }
}
