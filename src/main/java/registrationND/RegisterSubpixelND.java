package registrationND;

import ij.IJ;
import ij.ImagePlus;
import ij.Prefs;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.measure.ResultsTable;
import ij.plugin.PlugIn;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Subpixel translation registration of two open images/volumes
 * by phase cross-correlation.
 *
 * @author Eugene Katrukha
 */
public class RegisterSubpixelND implements PlugIn
{

	public static int defaultImg1 = 0;
	public static int defaultImg2 = 1;
	public int regChannel1 = 0;
	public int regChannel2 = 0;

	final String[] normChoices = new String[] {"phase", "none"};

	@Override
	public void run(String arg) {

		int d;

		final int[] idList = WindowManager.getIDList();

		if ( idList == null || idList.length < 2 )
		{
			IJ.error( "You need at least two open images." );
			return;
		}

		final String[] imgList = new String[ idList.length ];
		for ( int i = 0; i < idList.length; ++i )
			imgList[ i ] = WindowManager.getImage(idList[i]).getTitle();

		if ( defaultImg1 >= imgList.length || defaultImg2 >= imgList.length )
		{
			defaultImg1 = 0;
			defaultImg2 = 1;
		}

		final GenericDialog gdImages = new GenericDialog( "Subpixel registration" );
		gdImages.addChoice("Reference_image", imgList, imgList[ defaultImg1 ] );
		gdImages.addChoice("Moving_image", imgList, imgList[ defaultImg2 ] );
		gdImages.addNumericField("Upsample factor", Prefs.get(ConstantsRegistrationND.sPrefs+"nUpsample", 10), 0);
		gdImages.addChoice("Normalization", normChoices, Prefs.get(ConstantsRegistrationND.sPrefs+"sNormalization", normChoices[0]));
		gdImages.showDialog();

		if ( gdImages.wasCanceled() )
			return;

		final ImagePlus imp1 = WindowManager.getImage( idList[ defaultImg1 = gdImages.getNextChoiceIndex() ] );
		final ImagePlus imp2 = WindowManager.getImage( idList[ defaultImg2 = gdImages.getNextChoiceIndex() ] );
		final int nUpsample = (int) Math.max(1, Math.round(gdImages.getNextNumber()));
		Prefs.set(ConstantsRegistrationND.sPrefs+"nUpsample", nUpsample);
		final int nNorm = gdImages.getNextChoiceIndex();
		Prefs.set(ConstantsRegistrationND.sPrefs+"sNormalization", normChoices[nNorm]);

		final int numChannels1 = imp1.getNChannels();
		final int numChannels2 = imp2.getNChannels();

		if(numChannels1>1 || numChannels2>1)
		{
			final String[] channels1 = new String[ numChannels1 ];
			final String[] channels2 = new String[ numChannels2 ];
			for ( int c = 0; c < channels1.length; ++c )
				channels1[ c ] = "use channel " + Integer.toString(c+1);
			for ( int c = 0; c < channels2.length; ++c )
				channels2[ c ] = "use channel " + Integer.toString(c+1);

			final GenericDialog gdCh = new GenericDialog( "Choose registration channel" );
			gdCh.addChoice( "Reference_image_channel", channels1, channels1[ 0 ] );
			gdCh.addChoice( "Moving_image_channel", channels2, channels2[ 0 ] );
			gdCh.showDialog();

			if ( gdCh.wasCanceled() )
				return;
			regChannel1 = gdCh.getNextChoiceIndex();
			regChannel2 = gdCh.getNextChoiceIndex();
		}

		IJ.log("Registration ND plugin, version " + ConstantsRegistrationND.sVersion);
		IJ.log("Subpixel phase cross-correlation of "+imp2.getTitle()+" to "+imp1.getTitle());

		final Img< FloatType > reference = MiscUtils.convertFloatChannel(imp1, regChannel1);
		final Img< FloatType > moving = MiscUtils.convertFloatChannel(imp2, regChannel2);

		final PhaseCrossCorrelation pcc = new PhaseCrossCorrelation();
		pcc.upsampleFactor = nUpsample;
		pcc.normalization = (nNorm == 0) ? "phase" : null;
		pcc.bVerbose = true;

		final RegistrationResult result;
		try
		{
			result = pcc.calculate(reference, moving);
		}
		catch(IllegalArgumentException e)
		{
			IJ.error("Registration ND", e.getMessage());
			return;
		}

		final String sDims = MiscUtils.getDimensionsText(imp1);
		final ResultsTable ptable = ResultsTable.getResultsTable();
		ptable.incrementCounter();
		ptable.addValue("reference", imp1.getTitle());
		ptable.addValue("moving", imp2.getTitle());
		for(d=0;d<result.numDimensions();d++)
		{
			ptable.addValue("shift_"+sDims.charAt(d), result.getShift(d));
		}
		ptable.addValue("error", result.getError());
		ptable.addValue("phasediff", result.getPhaseDiff());
		ptable.show("Results");
	}

}
