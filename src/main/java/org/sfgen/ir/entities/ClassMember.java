package org.sfgen.ir.entities;

import org.sfgen.lang.SfgException;

/**
 * Base class of class members. A member is bound to exactly one class, exactly once.
 */
public abstract class ClassMember {

    private CppClass owningClass;
    private Visibility visibility;

    public CppClass owningClass() {
        if (owningClass == null) {
            throw new SfgException(this + " is not bound to a class.");
        }
        return owningClass;
    }

    public Visibility visibility() {
        if (visibility == null) {
            throw new SfgException(this + " is not bound to a class and therefore has no visibility.");
        }
        return visibility;
    }

    public boolean isBound() {
        return owningClass != null;
    }

    void bind(CppClass cls, Visibility vis) {
        if (owningClass != null) {
            throw new SfgException(this + " is already bound to class " + owningClass.name() + ".");
        }
        this.owningClass = cls;
        this.visibility = vis;
        onBind(cls);
    }

    /**
     * Called once the member has been bound.
     *
     * @param cls The owning class.
     */
    protected void onBind(CppClass cls) {
    }
}
