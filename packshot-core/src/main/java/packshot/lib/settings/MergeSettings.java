/*-
 * #%L
 * This file is part of PackShot.
 * %%
 * Copyright (C) 2024 PackShot developers
 * %%
 * PackShot is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PackShot is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PackShot.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package packshot.lib.settings;

/**
 * Settings for merging finished images with a decorative template.
 */
public class MergeSettings {

	private boolean enableMerge = false;
	private String templatePath = "";
	private Anchor position = Anchor.CENTER;
	private double templateWidthPercent = 0;
	private double templateHeightPercent = 0;
	private double opacityPercent = 100;
	private boolean templateOnTop = true;

	public boolean isEnableMerge() {
		return enableMerge;
	}

	public String getTemplatePath() {
		return templatePath;
	}

	public Anchor getPosition() {
		return position;
	}

	/**
	 * Template width as a percentage of the base width, or 0 to keep the template's own width.
	 * @return
	 */
	public double getTemplateWidthPercent() {
		return templateWidthPercent;
	}

	/**
	 * Template height as a percentage of the base height, or 0 to keep the template's own height.
	 * @return
	 */
	public double getTemplateHeightPercent() {
		return templateHeightPercent;
	}

	public double getOpacityPercent() {
		return opacityPercent;
	}

	/**
	 * Returns true if the template is drawn over the base image, false if it is drawn beneath it.
	 * @return
	 */
	public boolean isTemplateOnTop() {
		return templateOnTop;
	}

	void validate() {
		if (position == null)
			throw new IllegalArgumentException("Setting 'merge_settings.position' is not a valid anchor");
		SettingsChecks.checkRange("merge_settings.template_width_percent", templateWidthPercent, 0, 100);
		SettingsChecks.checkRange("merge_settings.template_height_percent", templateHeightPercent, 0, 100);
		SettingsChecks.checkRange("merge_settings.opacity_percent", opacityPercent, 0, 100);
		if (enableMerge && (templatePath == null || templatePath.isBlank()))
			throw new IllegalArgumentException("Setting 'merge_settings.template_path' is required when merging is enabled");
	}

}
