package zedtex.model.z;

import zedtex.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A whole input document: its items in order, plus the optional TITLE:, AUTHOR: and DATE: metadata.
 */
public class ZDocument extends ZNode {
	private final List<ZDocumentItem> items;
	private final String title;
	private final String author;
	private final String date;

	public ZDocument(SourceLocation location, List<ZDocumentItem> items, String title, String author, String date) {
		super(location);
		this.items = items;
		this.title = title;
		this.author = author;
		this.date = date;
	}

	public List<ZDocumentItem> getItems() {
		return items;
	}

	public String getTitle() {
		return title;
	}

	public String getAuthor() {
		return author;
	}

	public String getDate() {
		return date;
	}

	@Override
	public int hashCode() {
		return Objects.hash(items, title, author, date);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || obj.getClass() != getClass()) {
			return false;
		}
		ZDocument that = (ZDocument) obj;
		return items.equals(that.items) && Objects.equals(title, that.title) && Objects.equals(author, that.author)
				&& Objects.equals(date, that.date);
	}

	@Override
	public String toString() {
		return "ZDocument " + items;
	}
}
