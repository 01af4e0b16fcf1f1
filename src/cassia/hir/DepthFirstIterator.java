package cassia.hir;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Iterates over Traversable objects in depth-first pre-order. The iteration
* starts from the root object that was specified in the constructor. Shared
* sub-trees are visited once per occurrence.
*/
public class DepthFirstIterator<E extends Traversable> implements Iterator<E> {

    /** The root traversable object */
    protected final Traversable root;

    private final LinkedList<Traversable> stack;

    /**
    * Creates a new iterator with the specified initial traversable object.
    *
    * @param init The first object to visit.
    */
    public DepthFirstIterator(Traversable init) {
        root = init;
        stack = new LinkedList<Traversable>();
        stack.add(init);
    }

    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        Traversable t = stack.removeFirst();
        List<? extends Traversable> children = t.getChildren();
        for (int j = children.size() - 1; j >= 0; j--) {
            stack.addFirst(children.get(j));
        }
        return (E)t;
    }

    /**
    * Returns a list of objects of Class c in traversal order.
    *
    * @param c the object type to be collected.
    * @return the collected list.
    */
    @SuppressWarnings("unchecked")
    public <T extends Traversable> List<T> getList(Class<T> c) {
        List<T> ret = new ArrayList<T>();
        while (hasNext()) {
            Object o = next();
            if (c.isInstance(o)) {
                ret.add((T)o);
            }
        }
        return ret;
    }

    /**
    * Resets the iterator by setting the current position to the root object.
    */
    public void reset() {
        stack.clear();
        stack.add(root);
    }

    /** This operation is not supported. */
    public void remove() {
        throw new UnsupportedOperationException();
    }

}
