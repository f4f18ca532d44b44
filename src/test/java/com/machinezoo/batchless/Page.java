// Part of Batchless
package com.machinezoo.batchless;

import java.util.*;

class Page {
	final int id;
	final String slug;
	final int userId;
	Page(int id, String slug, int userId) {
		this.id = id;
		this.slug = slug;
		this.userId = userId;
	}
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Page))
			return false;
		Page other = (Page)obj;
		return id == other.id && Objects.equals(slug, other.slug) && userId == other.userId;
	}
	@Override
	public int hashCode() {
		return Objects.hash(id, slug, userId);
	}
	@Override
	public String toString() {
		return "Page(" + id + ", " + slug + ", " + userId + ")";
	}
}
