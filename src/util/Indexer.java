package util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense integer ids for a set of objects, in order of first insertion. Once
 * locked, unseen objects are rejected instead of being added.
 */
public class Indexer<T> {
	
	private final Map<T,Integer> indices;
	private final List<T> objects;
	private boolean locked;
	
	public Indexer() {
		this.indices = new HashMap<T,Integer>();
		this.objects = new ArrayList<T>();
		this.locked = false;
	}
	
	public Indexer(Collection<? extends T> objects) {
		this();
		for (T object : objects) getIndex(object);
	}
	
	public int getIndex(T object) {
		Integer index = indices.get(object);
		if (index != null) return index;
		if (locked) {
			throw new IllegalStateException("Indexer is locked, cannot add "+object);
		}
		index = objects.size();
		indices.put(object, index);
		objects.add(object);
		return index;
	}
	
	/**
	 * Index of the object, or -1 if it has never been indexed.
	 */
	public int indexOf(T object) {
		Integer index = indices.get(object);
		return index == null ? -1 : index;
	}
	
	public boolean contains(T object) {
		return indices.containsKey(object);
	}
	
	public T getObject(int index) {
		return objects.get(index);
	}
	
	public List<T> getObjects() {
		return Collections.unmodifiableList(objects);
	}
	
	public int size() {
		return objects.size();
	}
	
	public void lock() {
		this.locked = true;
	}
	
	public boolean isLocked() {
		return locked;
	}

}
