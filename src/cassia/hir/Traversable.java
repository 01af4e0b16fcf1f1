package cassia.hir;

import java.util.List;

/**
* Any class implementing this interface can act as a tree node by providing
* access to its children. Expression trees are immutable and do not keep a
* reference to their parent; the same sub-tree may appear under many parents.
*/
public interface Traversable extends Printable {

    /**
    * Provides access to the children of this object as a list. The returned
    * list is not modifiable; tree transformations build new nodes instead.
    *
    * @return the children as a list.
    */
    List<? extends Traversable> getChildren();

}
